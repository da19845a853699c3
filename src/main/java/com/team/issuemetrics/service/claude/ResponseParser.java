package com.team.issuemetrics.service.claude;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.issuemetrics.exception.AiEvaluationException;
import com.team.issuemetrics.model.evaluation.AiEvaluationResult;
import com.team.issuemetrics.model.evaluation.CategoryScore;
import com.team.issuemetrics.model.evaluation.EvaluationAxis;
import com.team.issuemetrics.model.evaluation.EvaluationCategory;
import com.team.issuemetrics.model.evaluation.EvaluationCriteria;
import com.team.issuemetrics.model.evaluation.Grade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses AI response text into an {@link AiEvaluationResult}.
 * Handles JSON extraction from markdown code blocks.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResponseParser {

    private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```json\\s*\\n?(.*?)\\n?```", Pattern.DOTALL);

    static final String NOT_EVALUATED_FEEDBACK = "Not evaluated";

    private final ObjectMapper objectMapper;

    /**
     * 解析品質或一致性評估的回應。
     * 類別依目錄順序排列，AI 漏掉的類別以 0 分計；不認得的類別或分數超出範圍則整筆視為失敗。
     *
     * @throws AiEvaluationException 回應不是預期的 JSON 或分數不合法
     */
    public AiEvaluationResult parseEvaluation(EvaluationAxis axis, String aiResponse) {
        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(aiResponse));
        } catch (JsonProcessingException e) {
            throw new AiEvaluationException("AI response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode categoriesNode = root.path("categories");
        if (!categoriesNode.isArray()) {
            throw new AiEvaluationException("AI response has no 'categories' array");
        }

        List<CategoryScore> reported = new ArrayList<>();
        for (JsonNode node : categoriesNode) {
            JsonNode score = node.path("score");
            if (!score.isNumber()) {
                throw new AiEvaluationException("Category '" + node.path("categoryId").asText() + "' has no numeric score");
            }
            reported.add(CategoryScore.builder()
                    .categoryId(node.path("categoryId").asText())
                    .score((int) Math.round(score.asDouble()))
                    .feedback(node.path("feedback").asText(""))
                    .build());
        }

        List<String> errors = EvaluationCriteria.validate(axis, reported);
        if (!errors.isEmpty()) {
            throw new AiEvaluationException("Invalid category scores: " + String.join("; ", errors));
        }

        List<CategoryScore> categories = normalize(axis, reported);
        int total = EvaluationCriteria.totalScore(categories);

        String suggestionsField = axis == EvaluationAxis.CONSISTENCY
                ? "issueImprovementSuggestions"
                : "improvementSuggestions";

        return AiEvaluationResult.builder()
                .axis(axis)
                .totalScore(total)
                .grade(Grade.fromScore(total))
                .categories(categories)
                .overallFeedback(root.path("overallFeedback").asText(""))
                .suggestions(stringList(root.path(suggestionsField)))
                .build();
    }

    /**
     * Extract JSON content from a response that may contain markdown code blocks.
     */
    String extractJson(String text) {
        if (text == null) {
            throw new AiEvaluationException("Empty AI response");
        }
        Matcher matcher = JSON_BLOCK_PATTERN.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        // Try to find raw JSON object
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new AiEvaluationException("No JSON found in AI response");
    }

    private List<CategoryScore> normalize(EvaluationAxis axis, List<CategoryScore> reported) {
        Map<String, CategoryScore> byId = new HashMap<>();
        for (CategoryScore score : reported) {
            byId.putIfAbsent(score.getCategoryId(), score);
        }

        List<CategoryScore> categories = new ArrayList<>();
        for (EvaluationCategory category : EvaluationCriteria.forAxis(axis)) {
            CategoryScore score = byId.get(category.id());
            if (score == null) {
                log.warn("AI 回應缺少類別 {}，以 0 分計", category.id());
            }
            categories.add(CategoryScore.builder()
                    .categoryId(category.id())
                    .categoryName(category.label())
                    .score(score != null ? score.getScore() : 0)
                    .maxScore(category.weight())
                    .feedback(score != null ? score.getFeedback() : NOT_EVALUATED_FEEDBACK)
                    .build());
        }
        return categories;
    }

    private List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        }
        return values;
    }
}
