package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.RepositoryProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RepositoryProfileRepository extends JpaRepository<RepositoryProfile, Long> {

    boolean existsByOwnerNameAndRepoName(String ownerName, String repoName);
}
