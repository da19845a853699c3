package com.team.issuemetrics.service.evaluation;

import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.IssueRecord.IssueState;
import com.team.issuemetrics.model.evaluation.SpeedScore;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 速度評估：Issue 建立到關閉的天數，不經過 AI。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SpeedEvaluationService {

    private final RepositoryProfileRepository repositoryRepo;
    private final IssueRecordRepository issueRepo;
    private final EvaluationRecorder evaluationRecorder;

    /**
     * 已關閉且有建立 / 關閉時間的 Issue 才有速度分數。
     */
    public static Optional<SpeedScore> speedOf(IssueRecord issue) {
        if (!issue.isClosed() || issue.getTrackerCreatedAt() == null || issue.getTrackerClosedAt() == null) {
            return Optional.empty();
        }
        return Optional.of(SpeedScore.between(issue.getTrackerCreatedAt(), issue.getTrackerClosedAt()));
    }

    /**
     * 計算並寫入 repository 內所有已關閉 Issue 的速度評估，其他評估軸不受影響。
     *
     * @return 寫入筆數
     */
    public int evaluateSpeed(Long repositoryId) {
        if (!repositoryRepo.existsById(repositoryId)) {
            throw new RepositoryNotFoundException(repositoryId);
        }

        List<IssueRecord> closedIssues =
                issueRepo.findByRepositoryIdAndStateOrderByTrackerNumberAsc(repositoryId, IssueState.CLOSED);

        int evaluated = 0;
        for (IssueRecord issue : closedIssues) {
            Optional<SpeedScore> speed = speedOf(issue);
            if (speed.isEmpty()) continue;

            evaluationRecorder.saveSpeed(issue.getId(), speed.get());
            evaluated++;
        }

        log.info("速度評估完成：repository={}, 已關閉 {} 筆, 寫入 {} 筆", repositoryId, closedIssues.size(), evaluated);
        return evaluated;
    }
}
