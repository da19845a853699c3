package com.team.issuemetrics.model.github;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GitHubPullRequest {

    private int number;
    private String title;
    private String body;
    /** open / closed（merge 與否看 mergedAt） */
    private String state;
    private String userLogin;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant mergedAt;
    private String htmlUrl;
    private int additions;
    private int deletions;

    public boolean isMerged() {
        return mergedAt != null;
    }
}
