package com.team.issuemetrics.model.evaluation;

/**
 * 五級評等（A 最佳 … E 最差）。
 * 所有評估軸（速度、品質、一致性）共用同一組分數門檻。
 *
 * <pre>
 * A: 81-100
 * B: 61-80
 * C: 41-60
 * D: 21-40
 * E: 0-20
 * </pre>
 */
public enum Grade {

    A(81, 100, "AI Ready"),
    B(61, 80, "Actionable"),
    C(41, 60, "Developing"),
    D(21, 40, "Needs Refinement"),
    E(0, 20, "Incomplete");

    private final int minScore;
    private final int maxScore;
    private final String label;

    Grade(int minScore, int maxScore, String label) {
        this.minScore = minScore;
        this.maxScore = maxScore;
        this.label = label;
    }

    /**
     * 由 0-100 的整數分數換算評等。
     *
     * @throws IllegalArgumentException 分數超出 0-100
     */
    public static Grade fromScore(int score) {
        for (Grade grade : values()) {
            if (score >= grade.minScore && score <= grade.maxScore) {
                return grade;
            }
        }
        throw new IllegalArgumentException("Score must be within 0-100: " + score);
    }

    /**
     * 由儲存的文字（"A"~"E"）還原，null 代表尚未評估。
     */
    public static Grade fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        return Grade.valueOf(code.trim().toUpperCase());
    }

    public int getMinScore() {
        return minScore;
    }

    public int getMaxScore() {
        return maxScore;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 比較兩個評等的優劣。
     *
     * @return 正值：this 較好；負值：other 較好；0：相同
     */
    public int compareQuality(Grade other) {
        // enum 宣告順序是 A → E，ordinal 越小越好
        return other.ordinal() - this.ordinal();
    }

    public boolean isBetterThan(Grade other) {
        return compareQuality(other) > 0;
    }
}
