package com.team.issuemetrics.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 每個 repository 一筆的同步狀態。
 * 沒有這筆資料 → 下次同步做全量；有 → 只抓 lastSyncAt 之後更新的 Issue。
 */
@Entity
@Table(name = "sync_metadata")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncMetadata {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long repositoryId;

    @Column(nullable = false)
    private Instant lastSyncAt;

    /** 上次同步時的目前衝刺編號 */
    private Integer lastSyncSprintNumber;

    private boolean lastSyncFull;
}
