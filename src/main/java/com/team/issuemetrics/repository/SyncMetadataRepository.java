package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.SyncMetadata;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SyncMetadataRepository extends JpaRepository<SyncMetadata, Long> {

    Optional<SyncMetadata> findByRepositoryId(Long repositoryId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SyncMetadata s WHERE s.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}
