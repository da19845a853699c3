package com.team.issuemetrics.exception;

/**
 * 與 GitHub 通訊失敗（認證、連線、非 2xx）。同步流程遇到即中止。
 */
public class IssueTrackerException extends RuntimeException {

    public IssueTrackerException(String message) {
        super(message);
    }

    public IssueTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
