package com.team.issuemetrics.model.evaluation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationCriteriaTest {

    @Test
    void catalogWeights_sumTo100() {
        assertThat(EvaluationCriteria.QUALITY_CATEGORIES.stream().mapToInt(EvaluationCategory::weight).sum())
                .isEqualTo(100);
        assertThat(EvaluationCriteria.CONSISTENCY_CATEGORIES.stream().mapToInt(EvaluationCategory::weight).sum())
                .isEqualTo(100);
    }

    @Test
    void totalScore_sumsCategoryScores() {
        List<CategoryScore> scores = List.of(
                score("context-goal", 25),
                score("implementation-details", 20),
                score("acceptance-criteria", 28),
                score("structure-clarity", 15));

        assertThat(EvaluationCriteria.validate(EvaluationAxis.QUALITY, scores)).isEmpty();
        int total = EvaluationCriteria.totalScore(scores);
        assertThat(total).isEqualTo(88);
        assertThat(Grade.fromScore(total)).isEqualTo(Grade.A);
    }

    @Test
    void validate_reportsUnknownAndOverweightCategories() {
        List<String> errors = EvaluationCriteria.validate(EvaluationAxis.QUALITY, List.of(
                score("context-goal", 26),
                score("requirement-coverage", 10),
                score("structure-clarity", -1)));

        assertThat(errors).hasSize(3);
        assertThat(errors.get(0)).contains("context-goal").contains("exceeds max (25)");
        assertThat(errors.get(1)).contains("Unknown category id: requirement-coverage");
        assertThat(errors.get(2)).contains("must not be negative");
    }

    @Test
    void forAxis_rejectsSpeed() {
        assertThatThrownBy(() -> EvaluationCriteria.forAxis(EvaluationAxis.SPEED))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(EvaluationCriteria.findById(EvaluationAxis.CONSISTENCY, "pr-description-clarity"))
                .hasValueSatisfying(c -> assertThat(c.weight()).isEqualTo(10));
    }

    private static CategoryScore score(String id, int score) {
        return CategoryScore.builder().categoryId(id).score(score).build();
    }
}
