package com.team.issuemetrics.model.evaluation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 與 Issue 關聯且已 merge 的 PR（一致性評估的輸入）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkedPullRequest {

    private int number;
    private String title;
    private String url;
    private String body;
    /** patch 內容（超過上限會截斷），沒有 patch 時為檔案變更摘要 */
    private String diffSummary;
    private List<String> changedFiles;
    private int additions;
    private int deletions;
    private Instant mergedAt;
}
