package com.team.issuemetrics.model.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 單一類別的評估結果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryScore {

    private String categoryId;
    private String categoryName;
    private int score;
    private int maxScore;
    private String feedback;
}
