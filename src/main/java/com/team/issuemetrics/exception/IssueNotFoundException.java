package com.team.issuemetrics.exception;

/**
 * 指定的 Issue 不存在，或不屬於指定的 repository。
 */
public class IssueNotFoundException extends RuntimeException {

    public IssueNotFoundException(Long repositoryId, Long issueId) {
        super("Issue not found: " + issueId + " (repository " + repositoryId + ")");
    }
}
