package com.team.issuemetrics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchEvaluationRequest {

    private Long repositoryId;
    /** quality / consistency */
    private String type;
    private Integer limit;
}
