package com.team.issuemetrics.controller;

import com.team.issuemetrics.exception.IssueNotFoundException;
import com.team.issuemetrics.exception.IssueTrackerException;
import com.team.issuemetrics.exception.RepositoryNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * 例外 → HTTP 狀態碼。
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({RepositoryNotFoundException.class, IssueNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("not_found", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("invalid_request", e.getMessage()));
    }

    @ExceptionHandler(IssueTrackerException.class)
    public ResponseEntity<Map<String, Object>> handleIssueTracker(IssueTrackerException e) {
        log.error("GitHub 通訊失敗：{}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body("issue_tracker_failed", e.getMessage()));
    }

    private Map<String, Object> body(String error, String details) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("details", details);
        return body;
    }
}
