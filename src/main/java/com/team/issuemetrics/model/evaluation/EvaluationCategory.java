package com.team.issuemetrics.model.evaluation;

/**
 * 評估類別定義（權重即該類別的滿分）。
 */
public record EvaluationCategory(String id, String label, int weight, String description) {
}
