package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.IssueRecord.IssueState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IssueRecordRepository extends JpaRepository<IssueRecord, Long> {

    Optional<IssueRecord> findByRepositoryIdAndTrackerNumber(Long repositoryId, int trackerNumber);

    List<IssueRecord> findByRepositoryIdOrderByTrackerNumberAsc(Long repositoryId);

    List<IssueRecord> findByRepositoryIdAndStateOrderByTrackerNumberAsc(Long repositoryId, IssueState state);

    /** 某個衝刺區間（含頭尾）的 Issue */
    @Query("SELECT i FROM IssueRecord i WHERE i.repositoryId = :repositoryId AND i.sprintNumber BETWEEN :fromSprint AND :toSprint ORDER BY i.trackerNumber")
    List<IssueRecord> findBySprintRange(@Param("repositoryId") Long repositoryId,
                                        @Param("fromSprint") int fromSprint,
                                        @Param("toSprint") int toSprint);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM IssueRecord i WHERE i.repositoryId = :repositoryId")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);
}
