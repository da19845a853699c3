package com.team.issuemetrics.model.evaluation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GradeTest {

    @ParameterizedTest
    @CsvSource({
            "100, A", "81, A",
            "80, B", "61, B",
            "60, C", "41, C",
            "40, D", "21, D",
            "20, E", "0, E"
    })
    void fromScore_mapsBoundariesToGrades(int score, Grade expected) {
        assertThat(Grade.fromScore(score)).isEqualTo(expected);
    }

    @Test
    void fromScore_rejectsOutOfRange() {
        assertThatThrownBy(() -> Grade.fromScore(101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Grade.fromScore(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromCode_returnsNullForBlank() {
        assertThat(Grade.fromCode(null)).isNull();
        assertThat(Grade.fromCode(" ")).isNull();
        assertThat(Grade.fromCode("b")).isEqualTo(Grade.B);
    }

    @Test
    void compareQuality_treatsAAsBest() {
        assertThat(Grade.A.isBetterThan(Grade.B)).isTrue();
        assertThat(Grade.E.isBetterThan(Grade.D)).isFalse();
        assertThat(Grade.C.compareQuality(Grade.C)).isZero();
    }
}
