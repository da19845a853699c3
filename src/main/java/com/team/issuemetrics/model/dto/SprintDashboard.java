package com.team.issuemetrics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SprintDashboard {

    private Long repositoryId;
    private String repositoryName;
    private SprintInfo sprint;
    private int totalIssues;
    private int closedIssues;
    private int openIssues;
    private List<UserSprintStats> users;
}
