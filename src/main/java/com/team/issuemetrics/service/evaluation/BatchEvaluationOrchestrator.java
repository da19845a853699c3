package com.team.issuemetrics.service.evaluation;

import com.team.issuemetrics.config.EvaluationConfig;
import com.team.issuemetrics.exception.RateLimitExceededException;
import com.team.issuemetrics.exception.RepositoryNotFoundException;
import com.team.issuemetrics.model.dto.BatchEvaluationResult;
import com.team.issuemetrics.model.dto.BatchEvaluationResult.ItemResult;
import com.team.issuemetrics.model.dto.BatchEvaluationResult.ItemStatus;
import com.team.issuemetrics.model.entity.Collaborator;
import com.team.issuemetrics.model.entity.EvaluationRecord;
import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.entity.IssueRecord.IssueState;
import com.team.issuemetrics.model.entity.RepositoryProfile;
import com.team.issuemetrics.model.evaluation.AiEvaluationResult;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.LinkedPullRequest;
import com.team.issuemetrics.repository.CollaboratorRepository;
import com.team.issuemetrics.repository.EvaluationRecordRepository;
import com.team.issuemetrics.repository.IssueRecordRepository;
import com.team.issuemetrics.repository.RepositoryProfileRepository;
import com.team.issuemetrics.service.github.GitHubPullRequestService;
import com.team.issuemetrics.util.Deadline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 品質 / 一致性的批次 AI 評估。
 *
 * 每次呼叫都從 DB 重新找出「該軸尚無分數」的 Issue，依 Issue 編號取前 limit 筆逐筆評估，
 * 所以呼叫端只要以相同參數重複呼叫到 remaining == 0 即可。評估失敗的 Issue 仍算在 remaining 內。
 * <ul>
 *   <li>成功：寫入分數，下一筆前等待固定間隔（最後一筆不等）</li>
 *   <li>一致性但沒有關聯的已 merge PR：略過，不呼叫 AI</li>
 *   <li>rate limit：立即結束本批次，沒輪到的都算 remaining</li>
 *   <li>其他錯誤：計入 errors，繼續下一筆</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchEvaluationOrchestrator {

    private final RepositoryProfileRepository repositoryRepo;
    private final IssueRecordRepository issueRepo;
    private final EvaluationRecordRepository evaluationRepo;
    private final CollaboratorRepository collaboratorRepo;
    private final QualityEvaluator qualityEvaluator;
    private final ConsistencyEvaluator consistencyEvaluator;
    private final GitHubPullRequestService pullRequestService;
    private final EvaluationRecorder evaluationRecorder;
    private final EvaluationConfig config;

    /** 兩筆之間的等待，測試時替換 */
    Sleeper sleeper = Thread::sleep;

    public BatchEvaluationResult runBatchEvaluation(Long repositoryId, EvaluationAxis axis, int limit) {
        return runBatchEvaluation(repositoryId, axis, limit, Deadline.none());
    }

    /**
     * @param deadline 只在兩筆之間檢查；超過期限時沒輪到的 Issue 計入 remaining
     */
    public BatchEvaluationResult runBatchEvaluation(Long repositoryId, EvaluationAxis axis, int limit,
                                                    Deadline deadline) {
        if (axis == EvaluationAxis.SPEED) {
            throw new IllegalArgumentException("Speed axis is not evaluated in batches");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be 1 or greater: " + limit);
        }

        RepositoryProfile repository = repositoryRepo.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));

        List<IssueRecord> pending = findPending(repositoryId, axis);
        List<IssueRecord> batch = pending.subList(0, Math.min(limit, pending.size()));

        log.info("開始批次評估：{} axis={}, 待評估 {} 筆, 本批次 {} 筆",
                repository.fullName(), axis, pending.size(), batch.size());

        return process(repository, axis, pending.size(), batch, deadline);
    }

    /**
     * 只評估指定的 Issue，已有分數的也會重新評估。
     * 不屬於該 repository 的 id 忽略；一致性只評估已關閉的 Issue。
     */
    public BatchEvaluationResult evaluateIssues(Long repositoryId, EvaluationAxis axis, Collection<Long> issueIds,
                                                Deadline deadline) {
        if (axis == EvaluationAxis.SPEED) {
            throw new IllegalArgumentException("Speed axis is not evaluated by AI");
        }
        if (issueIds == null || issueIds.isEmpty()) {
            throw new IllegalArgumentException("issueIds must not be empty");
        }

        RepositoryProfile repository = repositoryRepo.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));

        List<IssueRecord> selected = issueRepo.findAllById(issueIds).stream()
                .filter(issue -> repositoryId.equals(issue.getRepositoryId()))
                .filter(issue -> axis != EvaluationAxis.CONSISTENCY || issue.getState() == IssueState.CLOSED)
                .sorted(Comparator.comparingInt(IssueRecord::getTrackerNumber))
                .toList();

        log.info("開始指定評估：{} axis={}, 指定 {} 筆, 對象 {} 筆",
                repository.fullName(), axis, issueIds.size(), selected.size());

        return process(repository, axis, selected.size(), selected, deadline);
    }

    private BatchEvaluationResult process(RepositoryProfile repository, EvaluationAxis axis, int targetCount,
                                          List<IssueRecord> batch, Deadline deadline) {
        long delayMs = axis == EvaluationAxis.QUALITY ? config.getQualityDelayMs() : config.getConsistencyDelayMs();
        List<ItemResult> results = new ArrayList<>();
        boolean rateLimited = false;
        boolean deadlineReached = false;

        for (int i = 0; i < batch.size(); i++) {
            if (deadline.isExpired()) {
                log.warn("批次評估超過處理期限，剩餘 {} 筆留待下次", batch.size() - i);
                deadlineReached = true;
                break;
            }

            ItemResult result = evaluateItem(repository, axis, batch.get(i));
            results.add(result);

            if (result.getStatus() == ItemStatus.RATE_LIMITED) {
                rateLimited = true;
                break;
            }

            boolean last = i == batch.size() - 1;
            if (result.getStatus() == ItemStatus.EVALUATED && !last && !pause(delayMs)) {
                break;
            }
        }

        BatchEvaluationResult summary = summarize(axis, targetCount, results, rateLimited, deadlineReached);
        log.info("批次評估結束：{} axis={}, evaluated={}, skipped={}, errors={}, remaining={}{}",
                repository.fullName(), axis, summary.getEvaluated(), summary.getSkipped(),
                summary.getErrors(), summary.getRemaining(), rateLimited ? "（rate limit）" : "");
        return summary;
    }

    /**
     * 待評估的 Issue（依 Issue 編號排序）。一致性只看已關閉的 Issue。
     */
    List<IssueRecord> findPending(Long repositoryId, EvaluationAxis axis) {
        List<IssueRecord> issues = axis == EvaluationAxis.CONSISTENCY
                ? issueRepo.findByRepositoryIdAndStateOrderByTrackerNumberAsc(repositoryId, IssueState.CLOSED)
                : issueRepo.findByRepositoryIdOrderByTrackerNumberAsc(repositoryId);
        if (issues.isEmpty()) return List.of();

        Map<Long, EvaluationRecord> evaluations = evaluationRepo
                .findByIssueIdIn(issues.stream().map(IssueRecord::getId).toList())
                .stream()
                .collect(Collectors.toMap(EvaluationRecord::getIssueId, Function.identity()));

        return issues.stream()
                .filter(issue -> isPending(axis, issue, evaluations.get(issue.getId())))
                .toList();
    }

    private boolean isPending(EvaluationAxis axis, IssueRecord issue, EvaluationRecord evaluation) {
        if (evaluation == null) return true;
        if (axis == EvaluationAxis.QUALITY) {
            return evaluation.getQualityScore() == null;
        }
        if (evaluation.getConsistencyScore() != null) return false;
        // 略過後 Issue 沒有再被更新就不必重查 PR
        return evaluation.getConsistencySkippedAt() == null
                || (issue.getTrackerUpdatedAt() != null
                && issue.getTrackerUpdatedAt().isAfter(evaluation.getConsistencySkippedAt()));
    }

    private ItemResult evaluateItem(RepositoryProfile repository, EvaluationAxis axis, IssueRecord issue) {
        int number = issue.getTrackerNumber();
        try {
            return axis == EvaluationAxis.QUALITY
                    ? evaluateQuality(issue)
                    : evaluateConsistency(repository, issue);
        } catch (RateLimitExceededException e) {
            log.warn("Issue #{} 評估遇到 rate limit，停止本批次：{}", number, e.getMessage());
            return ItemResult.rateLimited(number, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Issue #{} {} 評估失敗，繼續下一筆：{}", number, axis, e.getMessage());
            return ItemResult.failed(number, e.getMessage());
        }
    }

    private ItemResult evaluateQuality(IssueRecord issue) {
        String assignee = issue.getAssigneeCollaboratorId() != null
                ? collaboratorRepo.findById(issue.getAssigneeCollaboratorId()).map(Collaborator::getUserName).orElse(null)
                : null;

        AiEvaluationResult result = qualityEvaluator.evaluate(issue, assignee).block();
        evaluationRecorder.saveQuality(issue.getId(), result);

        log.info("Issue #{} 品質評估完成：{} ({} 分)", issue.getTrackerNumber(), result.getGrade(), result.getTotalScore());
        return ItemResult.evaluated(issue.getTrackerNumber(), result.getTotalScore(), result.getGrade());
    }

    private ItemResult evaluateConsistency(RepositoryProfile repository, IssueRecord issue) {
        List<LinkedPullRequest> linked = pullRequestService.listLinkedMergedPullRequests(
                repository.getOwnerName(), repository.getRepoName(), issue.getTrackerNumber()).block();

        if (linked == null || linked.isEmpty()) {
            evaluationRecorder.markConsistencySkipped(issue.getId());
            log.info("Issue #{} 沒有關聯的已 merge PR，略過", issue.getTrackerNumber());
            return ItemResult.skipped(issue.getTrackerNumber(), "No linked merged pull requests");
        }

        AiEvaluationResult result = consistencyEvaluator.evaluate(issue, linked).block();
        evaluationRecorder.saveConsistency(issue.getId(), result);

        log.info("Issue #{} 一致性評估完成：{} ({} 分，PR {} 筆)",
                issue.getTrackerNumber(), result.getGrade(), result.getTotalScore(), linked.size());
        return ItemResult.evaluated(issue.getTrackerNumber(), result.getTotalScore(), result.getGrade());
    }

    /**
     * 失敗的 Issue 分數仍為空，下次還會列入待評估，所以算在 remaining 內。
     */
    private BatchEvaluationResult summarize(EvaluationAxis axis, int targetCount, List<ItemResult> results,
                                            boolean rateLimited, boolean deadlineReached) {
        int evaluated = count(results, ItemStatus.EVALUATED);
        int skipped = count(results, ItemStatus.SKIPPED);
        int errors = count(results, ItemStatus.FAILED);

        return BatchEvaluationResult.builder()
                .axis(axis)
                .evaluated(evaluated)
                .skipped(skipped)
                .errors(errors)
                .remaining(targetCount - evaluated - skipped)
                .rateLimited(rateLimited)
                .deadlineReached(deadlineReached)
                .items(results)
                .build();
    }

    private int count(List<ItemResult> results, ItemStatus status) {
        return (int) results.stream().filter(r -> r.getStatus() == status).count();
    }

    /**
     * @return false 表示等待中被中斷，批次應結束
     */
    private boolean pause(long delayMs) {
        if (delayMs <= 0) return true;
        try {
            sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("批次評估等待中被中斷，結束本批次");
            return false;
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
