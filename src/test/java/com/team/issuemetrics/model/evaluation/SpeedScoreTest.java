package com.team.issuemetrics.model.evaluation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeedScoreTest {

    @ParameterizedTest
    @CsvSource({
            "0, A, 100",
            "30, A, 100",
            "48, A, 100",
            "48.5, B, 80",
            "72, B, 80",
            "96, C, 60",
            "100, D, 40",
            "120, D, 40",
            "121, E, 20",
            "1000, E, 20"
    })
    void fromHours_appliesDayThresholds(double hours, Grade grade, int score) {
        SpeedScore speed = SpeedScore.fromHours(hours);

        assertThat(speed.getGrade()).isEqualTo(grade);
        assertThat(speed.getScore().getValue()).isEqualTo(score);
    }

    @Test
    void between_usesElapsedTimeBetweenInstants() {
        SpeedScore speed = SpeedScore.between(
                Instant.parse("2024-01-08T09:00:00Z"),
                Instant.parse("2024-01-09T15:00:00Z"));

        assertThat(speed.getElapsedHours()).isEqualTo(30.0);
        assertThat(speed.getGrade()).isEqualTo(Grade.A);
    }

    @Test
    void fromHours_rejectsNegativeDuration() {
        assertThatThrownBy(() -> SpeedScore.fromHours(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
