package com.team.issuemetrics.exception;

/**
 * 指定的 repository id 不存在。
 */
public class RepositoryNotFoundException extends RuntimeException {

    private final Long repositoryId;

    public RepositoryNotFoundException(Long repositoryId) {
        super("Repository not found: " + repositoryId);
        this.repositoryId = repositoryId;
    }

    public Long getRepositoryId() {
        return repositoryId;
    }
}
