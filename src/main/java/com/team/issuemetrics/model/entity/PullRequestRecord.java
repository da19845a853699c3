package com.team.issuemetrics.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 從 GitHub 同步的 Pull Request。
 * linkedIssueId 由 PR 本文中的 closes / fixes / resolves #N 解析而來（0..1）。
 */
@Entity
@Table(name = "pull_request_record",
        uniqueConstraints = @UniqueConstraint(columnNames = {"repositoryId", "trackerNumber"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequestRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long repositoryId;

    @Column(nullable = false)
    private int trackerNumber;

    @Column(nullable = false, length = 1024)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PullRequestState state;

    private Long authorCollaboratorId;

    private Long linkedIssueId;

    @Column(nullable = false)
    private Instant trackerCreatedAt;

    private Instant trackerMergedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public enum PullRequestState {
        OPEN, CLOSED, MERGED
    }
}
