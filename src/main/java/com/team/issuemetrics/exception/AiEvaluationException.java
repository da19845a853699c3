package com.team.issuemetrics.exception;

/**
 * AI 評估失敗：API 錯誤（非 rate limit）或回應格式不符。
 */
public class AiEvaluationException extends RuntimeException {

    public AiEvaluationException(String message) {
        super(message);
    }

    public AiEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
