package com.team.issuemetrics.model.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Issue ↔ PR 一致性評估明細（以 JSON 存在 evaluation.consistency_details）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyDetails {

    @Builder.Default
    private List<PullRequestRef> linkedPullRequests = new ArrayList<>();
    @Builder.Default
    private List<CategoryScore> categories = new ArrayList<>();
    private String overallFeedback;
    @Builder.Default
    private List<String> issueImprovementSuggestions = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PullRequestRef {
        private int number;
        private String title;
        private String url;
    }
}
