package com.team.issuemetrics.model.evaluation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 品質與一致性評估的固定類別目錄，兩者權重合計皆為 100。
 */
public final class EvaluationCriteria {

    public static final List<EvaluationCategory> QUALITY_CATEGORIES = List.of(
            new EvaluationCategory("context-goal", "Context & Goal", 25,
                    "Is it clear why this work is needed? Background, objective and the reason for its priority."),
            new EvaluationCategory("implementation-details", "Implementation Details", 25,
                    "Is it clear what exactly has to be built? Requirements, technical constraints, reference links."),
            new EvaluationCategory("acceptance-criteria", "Acceptance Criteria", 30,
                    "Is 'done' defined measurably? Checklist, abnormal/edge-case behaviour, quantitative targets."),
            new EvaluationCategory("structure-clarity", "Structure & Clarity", 20,
                    "Can another person grasp it at a glance? Markdown structure, diagrams, concise wording.")
    );

    public static final List<EvaluationCategory> CONSISTENCY_CATEGORIES = List.of(
            new EvaluationCategory("issue-evaluability", "Issue Evaluability", 20,
                    "Are the issue's requirements clear enough to judge whether the PR satisfies them?"),
            new EvaluationCategory("requirement-coverage", "Requirement Coverage", 30,
                    "Is every requirement written in the issue implemented by the PR?"),
            new EvaluationCategory("scope-appropriateness", "Scope Appropriateness", 20,
                    "Is the implementation neither short of nor beyond the issue's scope?"),
            new EvaluationCategory("acceptance-criteria-achievement", "Acceptance Criteria Achievement", 20,
                    "Does the PR meet the issue's acceptance criteria, where they are stated?"),
            new EvaluationCategory("pr-description-clarity", "PR Description Clarity", 10,
                    "Does the PR description explain the change and its relation to the issue?")
    );

    private EvaluationCriteria() {
    }

    public static List<EvaluationCategory> forAxis(EvaluationAxis axis) {
        return switch (axis) {
            case QUALITY -> QUALITY_CATEGORIES;
            case CONSISTENCY -> CONSISTENCY_CATEGORIES;
            case SPEED -> throw new IllegalArgumentException("Speed axis has no AI categories");
        };
    }

    public static Optional<EvaluationCategory> findById(EvaluationAxis axis, String categoryId) {
        return forAxis(axis).stream()
                .filter(c -> c.id().equals(categoryId))
                .findFirst();
    }

    /**
     * 檢查 AI 回傳的類別分數：不認得的類別、負分、超過滿分都算錯誤。
     *
     * @return 錯誤訊息清單，空清單表示通過
     */
    public static List<String> validate(EvaluationAxis axis, List<CategoryScore> scores) {
        List<String> errors = new ArrayList<>();
        for (CategoryScore score : scores) {
            Optional<EvaluationCategory> category = findById(axis, score.getCategoryId());
            if (category.isEmpty()) {
                errors.add("Unknown category id: " + score.getCategoryId());
                continue;
            }
            if (score.getScore() < 0) {
                errors.add(score.getCategoryId() + ": score must not be negative");
            }
            if (score.getScore() > category.get().weight()) {
                errors.add(String.format("%s: score (%d) exceeds max (%d)",
                        score.getCategoryId(), score.getScore(), category.get().weight()));
            }
        }
        return errors;
    }

    public static int totalScore(List<CategoryScore> scores) {
        return scores.stream().mapToInt(CategoryScore::getScore).sum();
    }
}
