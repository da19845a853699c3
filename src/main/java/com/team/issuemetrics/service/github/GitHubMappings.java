package com.team.issuemetrics.service.github;

import com.team.issuemetrics.model.github.ChangedFile;
import com.team.issuemetrics.model.github.GitHubIssue;
import com.team.issuemetrics.model.github.GitHubPullRequest;

import java.time.Instant;
import java.util.Map;

/**
 * GitHub REST v3 JSON（以 Map 讀入）→ 內部模型。
 */
final class GitHubMappings {

    private GitHubMappings() {
    }

    static GitHubIssue toIssue(Map<String, Object> json) {
        return GitHubIssue.builder()
                .number(intValue(json.get("number")))
                .title((String) json.get("title"))
                .body((String) json.get("body"))
                .state((String) json.get("state"))
                .userLogin(login(json.get("user")))
                .assigneeLogin(login(json.get("assignee")))
                .createdAt(instant(json.get("created_at")))
                .updatedAt(instant(json.get("updated_at")))
                .closedAt(instant(json.get("closed_at")))
                .htmlUrl((String) json.get("html_url"))
                .pullRequest(json.get("pull_request") != null)
                .build();
    }

    static GitHubPullRequest toPullRequest(Map<String, Object> json) {
        return GitHubPullRequest.builder()
                .number(intValue(json.get("number")))
                .title((String) json.get("title"))
                .body((String) json.get("body"))
                .state((String) json.get("state"))
                .userLogin(login(json.get("user")))
                .createdAt(instant(json.get("created_at")))
                .updatedAt(instant(json.get("updated_at")))
                .mergedAt(instant(json.get("merged_at")))
                .htmlUrl((String) json.get("html_url"))
                .additions(intValue(json.get("additions")))
                .deletions(intValue(json.get("deletions")))
                .build();
    }

    static ChangedFile toChangedFile(Map<String, Object> json) {
        return new ChangedFile(
                (String) json.get("filename"),
                (String) json.get("status"),
                intValue(json.get("additions")),
                intValue(json.get("deletions")),
                (String) json.get("patch"));
    }

    @SuppressWarnings("unchecked")
    static String login(Object user) {
        if (user instanceof Map) {
            return (String) ((Map<String, Object>) user).get("login");
        }
        return null;
    }

    static Instant instant(Object value) {
        if (value == null) return null;
        return Instant.parse(value.toString());
    }

    static int intValue(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }
}
