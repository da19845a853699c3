package com.team.issuemetrics.util;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlineTest {

    @Test
    void none_neverExpires() {
        assertThat(Deadline.none().isExpired()).isFalse();
    }

    @Test
    void after_expiresOnceBudgetIsUsed() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        Deadline deadline = Deadline.after(Duration.ofSeconds(55), clock);

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remaining()).isEqualTo(Duration.ofSeconds(55));

        clock.now = clock.now.plusSeconds(55);
        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
