package com.team.issuemetrics.model.evaluation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreTest {

    @Test
    void of_rejectsValuesOutsideRange() {
        assertThatThrownBy(() -> Score.of(101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Score.of(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Score.of(0).getGrade()).isEqualTo(Grade.E);
        assertThat(Score.of(100).getGrade()).isEqualTo(Grade.A);
    }

    @Test
    void average_roundsHalfAwayFromZero() {
        Score average = Score.average(List.of(Score.of(80), Score.of(81)));

        assertThat(average.getValue()).isEqualTo(81);
        assertThat(average.getGrade()).isEqualTo(Grade.A);
    }

    @Test
    void average_isTakenOverScoresNotGrades() {
        // A(100) 與 E(20) 平均為 C(60)
        Score average = Score.average(List.of(Score.of(100), Score.of(20)));

        assertThat(average.getValue()).isEqualTo(60);
        assertThat(average.getGrade()).isEqualTo(Grade.C);
    }

    @Test
    void average_requiresAtLeastOneScore() {
        assertThatThrownBy(() -> Score.average(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equality_isByValue() {
        assertThat(Score.of(42)).isEqualTo(Score.of(42)).hasSameHashCodeAs(Score.of(42));
        assertThat(Score.of(42).isHigherThan(Score.of(41))).isTrue();
    }
}
