package com.team.issuemetrics.exception;

/**
 * AI API 的 rate limit：provider 回 429，或本地 bucket 已用完。
 * 批次評估遇到時立即停止該批次，等呼叫端稍後重試。
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }

    public RateLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
