package com.team.issuemetrics.model.github;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * GitHub issues API 回傳的一筆資料。
 * issues 列表也會包含 PR，pullRequest=true 者需在同步前濾掉。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GitHubIssue {

    private int number;
    private String title;
    private String body;
    /** open / closed */
    private String state;
    private String userLogin;
    private String assigneeLogin;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant closedAt;
    private String htmlUrl;
    private boolean pullRequest;
}
