package com.team.issuemetrics.model.entity;

import com.team.issuemetrics.model.sprint.SprintConfig;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * 追蹤中的 GitHub repository 與其衝刺設定。
 * 由設定流程建立 / 更新，同步與評估流程只讀取。
 */
@Entity
@Table(name = "repository_profile",
        uniqueConstraints = @UniqueConstraint(columnNames = {"ownerName", "repoName"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepositoryProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String ownerName;

    @Column(nullable = false)
    private String repoName;

    /** 0=日 … 6=六 */
    @Builder.Default
    private int sprintStartDayOfWeek = SprintConfig.DEFAULT_START_DAY_OF_WEEK;

    @Builder.Default
    private int sprintDurationWeeks = SprintConfig.DEFAULT_DURATION_WEEKS;

    /** 衝刺 1 的基準日 */
    @Column(nullable = false)
    private LocalDate trackingStartDate;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public SprintConfig toSprintConfig(ZoneId zoneId) {
        return new SprintConfig(sprintStartDayOfWeek, sprintDurationWeeks, trackingStartDate, zoneId);
    }

    public String fullName() {
        return ownerName + "/" + repoName;
    }
}
