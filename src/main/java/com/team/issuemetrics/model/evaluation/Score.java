package com.team.issuemetrics.model.evaluation;

import java.util.Collection;

/**
 * 0-100 的整數評估分數。超出範圍視為程式錯誤，不做 clamp。
 */
public final class Score {

    public static final int MIN = 0;
    public static final int MAX = 100;

    private final int value;

    private Score(int value) {
        this.value = value;
    }

    public static Score of(int value) {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException("Score must be within 0-100: " + value);
        }
        return new Score(value);
    }

    /**
     * 先平均原始分數（四捨五入，.5 遠離零），再換算評等；不可直接平均評等。
     */
    public static Score average(Collection<Score> scores) {
        if (scores == null || scores.isEmpty()) {
            throw new IllegalArgumentException("At least one score is required to compute an average");
        }
        long sum = 0;
        for (Score score : scores) {
            sum += score.value;
        }
        return Score.of(roundHalfAwayFromZero((double) sum / scores.size()));
    }

    static int roundHalfAwayFromZero(double value) {
        return (int) (Math.signum(value) * Math.floor(Math.abs(value) + 0.5));
    }

    public int getValue() {
        return value;
    }

    public Grade getGrade() {
        return Grade.fromScore(value);
    }

    public boolean isHigherThan(Score other) {
        return value > other.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Score)) return false;
        return value == ((Score) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return value + " (" + getGrade() + ")";
    }
}
