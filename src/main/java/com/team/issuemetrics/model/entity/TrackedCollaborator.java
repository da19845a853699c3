package com.team.issuemetrics.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 列入統計範圍的 collaborator。
 * 某 repository 沒有任何 TrackedCollaborator 時，所有人的 Issue 都列入。
 */
@Entity
@Table(name = "tracked_collaborator",
        uniqueConstraints = @UniqueConstraint(columnNames = {"repositoryId", "collaboratorId"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackedCollaborator {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long repositoryId;

    @Column(nullable = false)
    private Long collaboratorId;

    private LocalDateTime createdAt;
}
