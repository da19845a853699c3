package com.team.issuemetrics.repository;

import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.evaluation.ConsistencyDetails;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.model.evaluation.QualityDetails;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 評估結果。各評估軸用獨立的 UPDATE 寫入，只動到該軸的欄位。
 */
@Repository
public interface EvaluationRecordRepository extends JpaRepository<EvaluationRecord, Long> {

    Optional<EvaluationRecord> findByIssueId(Long issueId);

    List<EvaluationRecord> findByIssueIdIn(Collection<Long> issueIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EvaluationRecord e SET e.speedScore = :score, e.speedGrade = :grade, "
            + "e.speedCalculatedAt = :at, e.updatedAt = :at WHERE e.issueId = :issueId")
    int updateSpeed(@Param("issueId") Long issueId,
                    @Param("score") int score,
                    @Param("grade") Grade grade,
                    @Param("at") LocalDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EvaluationRecord e SET e.qualityScore = :score, e.qualityGrade = :grade, "
            + "e.qualityDetails = :details, e.qualityCalculatedAt = :at, e.updatedAt = :at WHERE e.issueId = :issueId")
    int updateQuality(@Param("issueId") Long issueId,
                      @Param("score") int score,
                      @Param("grade") Grade grade,
                      @Param("details") QualityDetails details,
                      @Param("at") LocalDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EvaluationRecord e SET e.consistencyScore = :score, e.consistencyGrade = :grade, "
            + "e.consistencyDetails = :details, e.consistencyCalculatedAt = :at, e.updatedAt = :at WHERE e.issueId = :issueId")
    int updateConsistency(@Param("issueId") Long issueId,
                          @Param("score") int score,
                          @Param("grade") Grade grade,
                          @Param("details") ConsistencyDetails details,
                          @Param("at") LocalDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM EvaluationRecord e WHERE e.issueId IN "
            + "(SELECT i.id FROM IssueRecord i WHERE i.repositoryId = :repositoryId)")
    int deleteByRepositoryId(@Param("repositoryId") Long repositoryId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EvaluationRecord e SET e.consistencySkippedAt = :skippedAt, e.updatedAt = :at WHERE e.issueId = :issueId")
    int markConsistencySkipped(@Param("issueId") Long issueId,
                               @Param("skippedAt") Instant skippedAt,
                               @Param("at") LocalDateTime at);
}
