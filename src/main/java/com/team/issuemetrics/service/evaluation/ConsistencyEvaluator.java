package com.team.issuemetrics.service.evaluation;

import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.evaluation.AiEvaluationResult;
import com.team.issuemetrics.model.evaluation.ConsistencyDetails.PullRequestRef;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.LinkedPullRequest;
import com.team.issuemetrics.service.claude.ClaudeApiService;
import com.team.issuemetrics.service.claude.PromptBuilder;
import com.team.issuemetrics.service.claude.ResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Issue 與其已 merge PR 的一致性 AI 評估。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsistencyEvaluator {

    private final ClaudeApiService claudeApiService;
    private final PromptBuilder promptBuilder;
    private final ResponseParser responseParser;

    /**
     * @param linkedPullRequests 至少一筆；沒有關聯 PR 的 Issue 由呼叫端略過
     */
    public Mono<AiEvaluationResult> evaluate(IssueRecord issue, List<LinkedPullRequest> linkedPullRequests) {
        if (linkedPullRequests.isEmpty()) {
            return Mono.error(new IllegalArgumentException(
                    "Issue #" + issue.getTrackerNumber() + " has no linked pull requests"));
        }

        List<PullRequestRef> refs = linkedPullRequests.stream()
                .map(pr -> new PullRequestRef(pr.getNumber(), pr.getTitle(), pr.getUrl()))
                .toList();

        return Mono.fromCallable(() -> promptBuilder.buildConsistencyPrompt(
                        issue.getTrackerNumber(), issue.getTitle(), issue.getBody(), linkedPullRequests))
                .flatMap(claudeApiService::generate)
                .map(response -> {
                    AiEvaluationResult result = responseParser.parseEvaluation(EvaluationAxis.CONSISTENCY, response);
                    result.setLinkedPullRequests(refs);
                    return result;
                })
                .doOnSuccess(result -> log.debug("Issue #{} 一致性評估：{} ({} 分，PR {} 筆)",
                        issue.getTrackerNumber(), result.getGrade(), result.getTotalScore(), refs.size()));
    }
}
