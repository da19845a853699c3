package com.team.issuemetrics.model.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 品質評估明細（以 JSON 存在 evaluation.quality_details）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityDetails {

    @Builder.Default
    private List<CategoryScore> categories = new ArrayList<>();
    private String overallFeedback;
    @Builder.Default
    private List<String> improvementSuggestions = new ArrayList<>();
}
