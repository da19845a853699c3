package com.team.issuemetrics.service.claude;

import com.team.issuemetrics.model.evaluation.EvaluationCategory;
import com.team.issuemetrics.model.evaluation.EvaluationCriteria;
import com.team.issuemetrics.model.evaluation.LinkedPullRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds evaluation prompts from template files under src/main/resources/prompts/.
 * Category lists are rendered from {@link EvaluationCriteria} so the prompt and the
 * score validation always agree on ids and maxima.
 */
@Component
@Slf4j
public class PromptBuilder {

    static final String QUALITY_TEMPLATE = "quality-evaluation";
    static final String CONSISTENCY_TEMPLATE = "consistency-evaluation";

    private final Map<String, String> templates = new HashMap<>();

    @PostConstruct
    public void loadTemplates() {
        loadTemplate(QUALITY_TEMPLATE, "prompts/quality-evaluation.txt");
        loadTemplate(CONSISTENCY_TEMPLATE, "prompts/consistency-evaluation.txt");
        log.info("Loaded {} prompt templates", templates.size());
    }

    private void loadTemplate(String name, String path) {
        try {
            ClassPathResource resource = new ClassPathResource(path);
            String content = new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            templates.put(name, content);
        } catch (IOException e) {
            throw new IllegalStateException("Could not load prompt template '" + name + "' from " + path, e);
        }
    }

    /**
     * Issue 記述品質評估的 prompt。
     */
    public String buildQualityPrompt(int issueNumber, String title, String body, String assignee) {
        return template(QUALITY_TEMPLATE)
                .replace("{{CATEGORIES}}", describe(EvaluationCriteria.QUALITY_CATEGORIES))
                .replace("{{ISSUE_NUMBER}}", String.valueOf(issueNumber))
                .replace("{{ISSUE_TITLE}}", nullToEmpty(title))
                .replace("{{ASSIGNEE}}", assignee != null ? assignee : "(unassigned)")
                .replace("{{ISSUE_BODY}}", body != null && !body.isBlank() ? body : "(no description)");
    }

    /**
     * Issue ↔ 已 merge PR 一致性評估的 prompt。
     */
    public String buildConsistencyPrompt(int issueNumber, String title, String body,
                                         List<LinkedPullRequest> linkedPullRequests) {
        String prs = linkedPullRequests.stream()
                .map(this::describe)
                .collect(Collectors.joining("\n---\n"));

        return template(CONSISTENCY_TEMPLATE)
                .replace("{{CATEGORIES}}", describe(EvaluationCriteria.CONSISTENCY_CATEGORIES))
                .replace("{{ISSUE_NUMBER}}", String.valueOf(issueNumber))
                .replace("{{ISSUE_TITLE}}", nullToEmpty(title))
                .replace("{{ISSUE_BODY}}", body != null && !body.isBlank() ? body : "(no description)")
                .replace("{{PR_COUNT}}", String.valueOf(linkedPullRequests.size()))
                .replace("{{PULL_REQUESTS}}", prs);
    }

    private String template(String name) {
        String template = templates.get(name);
        if (template == null) {
            throw new IllegalStateException("Prompt template not loaded: " + name);
        }
        return template;
    }

    private String describe(List<EvaluationCategory> categories) {
        return categories.stream()
                .map(c -> String.format("- %s (%s, max %d): %s", c.id(), c.label(), c.weight(), c.description()))
                .collect(Collectors.joining("\n"));
    }

    private String describe(LinkedPullRequest pr) {
        return """
                ### PR #%d: %s
                - URL: %s
                - Changed files: %d
                - Additions: %d, Deletions: %d
                - Merged at: %s

                #### Description
                %s

                #### Changes (diff)
                ```
                %s
                ```
                """.formatted(
                pr.getNumber(), nullToEmpty(pr.getTitle()), nullToEmpty(pr.getUrl()),
                pr.getChangedFiles() != null ? pr.getChangedFiles().size() : 0,
                pr.getAdditions(), pr.getDeletions(), pr.getMergedAt(),
                pr.getBody() != null && !pr.getBody().isBlank() ? pr.getBody() : "(no description)",
                pr.getDiffSummary() != null && !pr.getDiffSummary().isBlank() ? pr.getDiffSummary() : "(no diff)");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
