package com.team.issuemetrics.model.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * AI 評估（品質或一致性）整理後的結果。
 * totalScore 為各類別分數加總，grade 由 totalScore 換算。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiEvaluationResult {

    private EvaluationAxis axis;
    private int totalScore;
    private Grade grade;
    private List<CategoryScore> categories;
    private String overallFeedback;
    /** 品質：改善建議；一致性：Issue 記述的改善建議 */
    private List<String> suggestions;
    private List<ConsistencyDetails.PullRequestRef> linkedPullRequests;

    public QualityDetails toQualityDetails() {
        return QualityDetails.builder()
                .categories(categories)
                .overallFeedback(overallFeedback)
                .improvementSuggestions(suggestions)
                .build();
    }

    public ConsistencyDetails toConsistencyDetails() {
        return ConsistencyDetails.builder()
                .linkedPullRequests(linkedPullRequests != null ? linkedPullRequests : List.of())
                .categories(categories)
                .overallFeedback(overallFeedback)
                .issueImprovementSuggestions(suggestions)
                .build();
    }
}
