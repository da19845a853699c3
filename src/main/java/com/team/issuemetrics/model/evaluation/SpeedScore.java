package com.team.issuemetrics.model.evaluation;

import java.time.Duration;
import java.time.Instant;

/**
 * 完成速度（Issue 建立 → 關閉）評分。
 *
 * <pre>
 * ≤ 2 天 → A / 100
 * ≤ 3 天 → B / 80
 * ≤ 4 天 → C / 60
 * ≤ 5 天 → D / 40
 * 其他   → E / 20
 * </pre>
 */
public final class SpeedScore {

    private static final double[] MAX_DAYS = {2, 3, 4, 5};
    private static final int[] SCORES = {100, 80, 60, 40};
    private static final int MIN_SCORE = 20;

    private final Score score;
    private final double elapsedHours;

    private SpeedScore(Score score, double elapsedHours) {
        this.score = score;
        this.elapsedHours = elapsedHours;
    }

    public static SpeedScore fromHours(double elapsedHours) {
        if (elapsedHours < 0) {
            throw new IllegalArgumentException("Elapsed time must not be negative: " + elapsedHours);
        }
        double days = elapsedHours / 24.0;
        for (int i = 0; i < MAX_DAYS.length; i++) {
            if (days <= MAX_DAYS[i]) {
                return new SpeedScore(Score.of(SCORES[i]), elapsedHours);
            }
        }
        return new SpeedScore(Score.of(MIN_SCORE), elapsedHours);
    }

    public static SpeedScore between(Instant createdAt, Instant closedAt) {
        double hours = Duration.between(createdAt, closedAt).toMillis() / 3_600_000.0;
        return fromHours(hours);
    }

    public Score getScore() {
        return score;
    }

    public Grade getGrade() {
        return score.getGrade();
    }

    public double getElapsedHours() {
        return elapsedHours;
    }
}
