package com.team.issuemetrics.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 一次同步的結果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private Long repositoryId;
    private int syncedCount;
    /** 不在追蹤名單內而略過的 Issue */
    private int skippedCount;
    /** 單筆 upsert 失敗的 Issue / PR */
    private int failedCount;
    private int prSyncedCount;
    private boolean fullSync;
    private Instant lastSyncedAt;
}
