package com.team.issuemetrics.model.dto;

import com.team.issuemetrics.model.evaluation.ConsistencyDetails;
import com.team.issuemetrics.model.evaluation.Grade;
import com.team.issuemetrics.model.evaluation.QualityDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 單一 Issue 的三軸評估結果，尚未評估的軸為 null。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueEvaluation {

    private Long issueId;
    private int issueNumber;
    private String title;
    private String state;
    private Integer sprintNumber;

    private Integer speedScore;
    private Grade speedGrade;

    private Integer qualityScore;
    private Grade qualityGrade;
    private QualityDetails qualityDetails;
    private LocalDateTime qualityCalculatedAt;

    private Integer consistencyScore;
    private Grade consistencyGrade;
    private ConsistencyDetails consistencyDetails;
    private LocalDateTime consistencyCalculatedAt;
}
