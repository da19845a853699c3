package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.PullRequestRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PullRequestRecordRepository extends JpaRepository<PullRequestRecord, Long> {

    Optional<PullRequestRecord> findByRepositoryIdAndTrackerNumber(Long repositoryId, int trackerNumber);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM PullRequestRecord p WHERE p.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}
