package com.team.issuemetrics.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 呼叫端給的處理期限。批次只在兩筆之間檢查，不會中斷進行中的那一筆。
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget), clock);
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        if (expiresAt == null) return Duration.ofMillis(Long.MAX_VALUE);
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
