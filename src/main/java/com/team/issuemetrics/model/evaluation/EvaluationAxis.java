package com.team.issuemetrics.model.evaluation;

/**
 * 評估軸。SPEED 為確定性計算，QUALITY / CONSISTENCY 需呼叫 AI。
 */
public enum EvaluationAxis {
    SPEED,
    QUALITY,
    CONSISTENCY;

    /**
     * 解析 API 傳入的 "quality" / "consistency" 等字串。
     *
     * @throws IllegalArgumentException 不認得的軸
     */
    public static EvaluationAxis parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Evaluation type is required");
        }
        try {
            return EvaluationAxis.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown evaluation type: " + value);
        }
    }
}
