package com.team.issuemetrics.model.dto;

import com.team.issuemetrics.model.evaluation.Grade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 單一使用者（或整個團隊）在某衝刺的統計。
 * 平均分數為原始分數的平均（四捨五入），等級由平均分數換算，沒有資料時為 null。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSprintStats {

    private String userName;
    private int totalIssues;
    private int closedIssues;
    private int openIssues;

    private Integer averageSpeedScore;
    private Grade speedGrade;
    private int speedEvaluatedCount;

    private Integer averageQualityScore;
    private Grade qualityGrade;
    private int qualityEvaluatedCount;

    private Integer averageConsistencyScore;
    private Grade consistencyGrade;
    private int consistencyEvaluatedCount;
}
