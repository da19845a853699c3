package com.team.issuemetrics.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 從 GitHub 同步的 Issue。
 * 只由同步流程寫入；sprintNumber 在第一次同步時依 trackerCreatedAt 計算後即固定。
 */
@Entity
@Table(name = "issue_record",
        uniqueConstraints = @UniqueConstraint(columnNames = {"repositoryId", "trackerNumber"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long repositoryId;

    /** GitHub 上的 Issue 編號 */
    @Column(nullable = false)
    private int trackerNumber;

    @Column(nullable = false, length = 1024)
    private String title;

    @Column(length = 65535)
    private String body;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IssueState state;

    private Long authorCollaboratorId;

    private Long assigneeCollaboratorId;

    private Integer sprintNumber;

    @Column(nullable = false)
    private Instant trackerCreatedAt;

    private Instant trackerClosedAt;

    /** GitHub 上的最後更新時間 */
    private Instant trackerUpdatedAt;

    private String htmlUrl;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isClosed() {
        return state == IssueState.CLOSED;
    }

    public enum IssueState {
        OPEN, CLOSED;

        public static IssueState fromGitHub(String state) {
            return "closed".equalsIgnoreCase(state) ? CLOSED : OPEN;
        }
    }
}
