package com.team.issuemetrics.model.dto;

import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.Grade;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次批次評估的結果。remaining 為 0 之前，呼叫端以相同參數重複呼叫即可接續。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchEvaluationResult {

    private EvaluationAxis axis;
    private int evaluated;
    private int errors;
    private int skipped;
    /** 尚未處理的待評估數（含因 rate limit / 期限而沒輪到的） */
    private int remaining;
    /** 此批次因 rate limit 提前結束 */
    private boolean rateLimited;
    /** 此批次因處理期限提前結束 */
    private boolean deadlineReached;
    @Builder.Default
    private List<ItemResult> items = new ArrayList<>();

    public enum ItemStatus {
        EVALUATED, SKIPPED, FAILED, RATE_LIMITED
    }

    /**
     * 單一 Issue 的處理結果。
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemResult {
        private int issueNumber;
        private ItemStatus status;
        private Integer score;
        private Grade grade;
        private String message;

        public static ItemResult evaluated(int issueNumber, int score, Grade grade) {
            return new ItemResult(issueNumber, ItemStatus.EVALUATED, score, grade, null);
        }

        public static ItemResult skipped(int issueNumber, String reason) {
            return new ItemResult(issueNumber, ItemStatus.SKIPPED, null, null, reason);
        }

        public static ItemResult failed(int issueNumber, String error) {
            return new ItemResult(issueNumber, ItemStatus.FAILED, null, null, error);
        }

        public static ItemResult rateLimited(int issueNumber, String error) {
            return new ItemResult(issueNumber, ItemStatus.RATE_LIMITED, null, null, error);
        }
    }
}
