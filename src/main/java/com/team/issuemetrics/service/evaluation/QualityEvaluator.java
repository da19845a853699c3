package com.team.issuemetrics.service.evaluation;

import com.team.issuemetrics.model.entity.IssueRecord;
import com.team.issuemetrics.model.evaluation.AiEvaluationResult;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.service.claude.ClaudeApiService;
import com.team.issuemetrics.service.claude.PromptBuilder;
import com.team.issuemetrics.service.claude.ResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Issue 記述品質的 AI 評估。
 * 合計分數為各類別分數加總（類別滿分合計 100），等級由合計分數換算。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QualityEvaluator {

    private final ClaudeApiService claudeApiService;
    private final PromptBuilder promptBuilder;
    private final ResponseParser responseParser;

    public Mono<AiEvaluationResult> evaluate(IssueRecord issue, String assignee) {
        return Mono.fromCallable(() -> promptBuilder.buildQualityPrompt(
                        issue.getTrackerNumber(), issue.getTitle(), issue.getBody(), assignee))
                .flatMap(claudeApiService::generate)
                .map(response -> responseParser.parseEvaluation(EvaluationAxis.QUALITY, response))
                .doOnSuccess(result -> log.debug("Issue #{} 品質評估：{} ({} 分)",
                        issue.getTrackerNumber(), result.getGrade(), result.getTotalScore()));
    }
}
