package com.team.issuemetrics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueEvaluationRequest {

    private Long repositoryId;
    /** IssueRecord 的 id */
    private List<Long> issueIds;
}
