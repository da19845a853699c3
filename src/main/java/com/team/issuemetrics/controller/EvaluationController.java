package com.team.issuemetrics.controller;

import com.team.issuemetrics.config.EvaluationConfig;
import com.team.issuemetrics.model.dto.BatchEvaluationRequest;
import com.team.issuemetrics.model.dto.BatchEvaluationResult;
import com.team.issuemetrics.model.dto.IssueEvaluation;
import com.team.issuemetrics.model.dto.IssueEvaluationRequest;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.service.evaluation.BatchEvaluationOrchestrator;
import com.team.issuemetrics.service.evaluation.EvaluationQueryService;
import com.team.issuemetrics.service.evaluation.SpeedEvaluationService;
import com.team.issuemetrics.util.Deadline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 評估 API。
 *
 * 批次評估一次只處理 limit 筆（上限 maxBatchSize），呼叫端重複呼叫直到 remaining 為 0。
 *
 * - POST /api/evaluations/batch                         待評估的 Issue 依序評估
 * - POST /api/evaluations/quality|consistency           只評估指定的 Issue
 * - POST /api/evaluations/speed?repositoryId=           速度
 * - GET  /api/evaluations?repositoryId=                 評估結果一覽
 * - GET  /api/evaluations/issues/{issueId}?repositoryId= 單一 Issue 的評估結果
 */
@RestController
@RequestMapping("/api/evaluations")
@Slf4j
@RequiredArgsConstructor
public class EvaluationController {

    private final BatchEvaluationOrchestrator batchEvaluationOrchestrator;
    private final SpeedEvaluationService speedEvaluationService;
    private final EvaluationQueryService evaluationQueryService;
    private final EvaluationConfig config;

    @PostMapping("/batch")
    public ResponseEntity<BatchEvaluationResult> runBatch(@RequestBody BatchEvaluationRequest request) {
        if (request.getRepositoryId() == null) {
            throw new IllegalArgumentException("repositoryId is required");
        }
        EvaluationAxis axis = EvaluationAxis.parse(request.getType());
        if (axis == EvaluationAxis.SPEED) {
            throw new IllegalArgumentException("type must be 'quality' or 'consistency'");
        }

        int requested = request.getLimit() != null ? request.getLimit() : config.getDefaultBatchSize();
        int limit = Math.max(1, Math.min(requested, config.getMaxBatchSize()));

        log.info("收到批次評估請求：repository={}, type={}, limit={}", request.getRepositoryId(), axis, limit);
        BatchEvaluationResult result = batchEvaluationOrchestrator.runBatchEvaluation(
                request.getRepositoryId(), axis, limit,
                Deadline.after(Duration.ofSeconds(config.getRequestTimeoutSeconds())));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/quality")
    public ResponseEntity<BatchEvaluationResult> evaluateQuality(@RequestBody IssueEvaluationRequest request) {
        return ResponseEntity.ok(evaluateSelected(EvaluationAxis.QUALITY, request));
    }

    @PostMapping("/consistency")
    public ResponseEntity<BatchEvaluationResult> evaluateConsistency(@RequestBody IssueEvaluationRequest request) {
        return ResponseEntity.ok(evaluateSelected(EvaluationAxis.CONSISTENCY, request));
    }

    @GetMapping
    public ResponseEntity<List<IssueEvaluation>> list(@RequestParam Long repositoryId) {
        return ResponseEntity.ok(evaluationQueryService.listEvaluations(repositoryId));
    }

    @GetMapping("/issues/{issueId}")
    public ResponseEntity<IssueEvaluation> get(@PathVariable Long issueId, @RequestParam Long repositoryId) {
        return ResponseEntity.ok(evaluationQueryService.getEvaluation(repositoryId, issueId));
    }

    @PostMapping("/speed")
    public ResponseEntity<Map<String, Object>> runSpeed(@RequestParam Long repositoryId) {
        int evaluated = speedEvaluationService.evaluateSpeed(repositoryId);
        return ResponseEntity.ok(Map.of(
                "repositoryId", repositoryId,
                "evaluated", evaluated));
    }

    private BatchEvaluationResult evaluateSelected(EvaluationAxis axis, IssueEvaluationRequest request) {
        if (request.getRepositoryId() == null) {
            throw new IllegalArgumentException("repositoryId is required");
        }
        List<Long> issueIds = request.getIssueIds() != null ? request.getIssueIds() : List.of();
        if (issueIds.size() > config.getMaxBatchSize()) {
            throw new IllegalArgumentException("issueIds must not exceed " + config.getMaxBatchSize() + " items");
        }

        log.info("收到指定評估請求：repository={}, type={}, issues={}", request.getRepositoryId(), axis, issueIds);
        return batchEvaluationOrchestrator.evaluateIssues(request.getRepositoryId(), axis, issueIds,
                Deadline.after(Duration.ofSeconds(config.getRequestTimeoutSeconds())));
    }
}
