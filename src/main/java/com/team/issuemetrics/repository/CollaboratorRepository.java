package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.Collaborator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CollaboratorRepository extends JpaRepository<Collaborator, Long> {

    Optional<Collaborator> findByRepositoryIdAndUserName(Long repositoryId, String userName);

    List<Collaborator> findByRepositoryId(Long repositoryId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM Collaborator c WHERE c.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}
