package com.team.issuemetrics.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 從 PR 本文解析 closing keyword（closes #12、Fixes #3、resolved: #7 ...）。
 */
public final class IssueReferenceParser {

    private static final Pattern CLOSING_REFERENCE = Pattern.compile(
            "\\b(?:close[sd]?|fix(?:e[sd])?|resolve[sd]?)\\s*:?\\s+#(\\d+)\\b",
            Pattern.CASE_INSENSITIVE);

    private IssueReferenceParser() {
    }

    /**
     * 第一個被 closing keyword 參照的 Issue 編號。
     */
    public static Optional<Integer> firstClosingReference(String body) {
        if (body == null || body.isBlank()) return Optional.empty();

        Matcher matcher = CLOSING_REFERENCE.matcher(body);
        if (matcher.find()) {
            try {
                return Optional.of(Integer.parseInt(matcher.group(1)));
            } catch (NumberFormatException e) {
                // 超過 int 範圍的編號不可能是有效 Issue
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
