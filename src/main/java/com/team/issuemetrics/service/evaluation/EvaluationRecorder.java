package com.team.issuemetrics.service.evaluation;

import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.evaluation.AiEvaluationResult;
import com.team.issuemetrics.model.evaluation.SpeedScore;
import com.team.issuemetrics.repository.EvaluationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 評估結果寫入。
 * 先確保 Issue 有一筆 EvaluationRecord，再以各軸專用的 UPDATE 只寫該軸欄位。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EvaluationRecorder {

    private final EvaluationRecordRepository evaluationRepo;

    @Transactional
    public void saveSpeed(Long issueId, SpeedScore speed) {
        ensureRecord(issueId);
        evaluationRepo.updateSpeed(issueId, speed.getScore().getValue(), speed.getGrade(), LocalDateTime.now());
    }

    @Transactional
    public void saveQuality(Long issueId, AiEvaluationResult result) {
        ensureRecord(issueId);
        evaluationRepo.updateQuality(issueId, result.getTotalScore(), result.getGrade(),
                result.toQualityDetails(), LocalDateTime.now());
    }

    @Transactional
    public void saveConsistency(Long issueId, AiEvaluationResult result) {
        ensureRecord(issueId);
        evaluationRepo.updateConsistency(issueId, result.getTotalScore(), result.getGrade(),
                result.toConsistencyDetails(), LocalDateTime.now());
    }

    /**
     * 記錄「沒有關聯的已 merge PR」；GitHub 上的 Issue 之後有更新前不再列入一致性待評估。
     */
    @Transactional
    public void markConsistencySkipped(Long issueId) {
        ensureRecord(issueId);
        evaluationRepo.markConsistencySkipped(issueId, Instant.now(), LocalDateTime.now());
    }

    private void ensureRecord(Long issueId) {
        if (evaluationRepo.findByIssueId(issueId).isPresent()) return;

        LocalDateTime now = LocalDateTime.now();
        evaluationRepo.saveAndFlush(EvaluationRecord.builder()
                .issueId(issueId)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.debug("已建立 Issue {} 的評估記錄", issueId);
    }
}
