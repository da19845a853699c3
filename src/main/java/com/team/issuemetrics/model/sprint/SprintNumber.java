package com.team.issuemetrics.model.sprint;

/**
 * 衝刺編號。一般為 1 以上；追蹤起始日之前的歷史 Issue 會得到 0 以下，
 * 必須透過 {@link #allowingZeroOrNegative(int)} 明確建立。
 */
public record SprintNumber(int value) implements Comparable<SprintNumber> {

    public static SprintNumber of(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("Sprint number must be 1 or greater: " + value);
        }
        return new SprintNumber(value);
    }

    public static SprintNumber allowingZeroOrNegative(int value) {
        return new SprintNumber(value);
    }

    public SprintNumber plus(int offset) {
        return allowingZeroOrNegative(value + offset);
    }

    public boolean isBeforeTracking() {
        return value < 1;
    }

    @Override
    public int compareTo(SprintNumber other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "Sprint " + value;
    }
}
