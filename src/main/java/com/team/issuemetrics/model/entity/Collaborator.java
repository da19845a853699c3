package com.team.issuemetrics.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * GitHub 使用者（以 repository 為範圍）。
 * 同步時第一次看到某個 login 就自動建立，(repositoryId, userName) 唯一。
 */
@Entity
@Table(name = "collaborator",
        uniqueConstraints = @UniqueConstraint(columnNames = {"repositoryId", "userName"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Collaborator {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long repositoryId;

    @Column(nullable = false)
    private String userName;

    private LocalDateTime firstSeenAt;
}
