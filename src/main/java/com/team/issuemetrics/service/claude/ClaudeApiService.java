package com.team.issuemetrics.service.claude;

import com.team.issuemetrics.config.ClaudeApiConfig;
import com.team.issuemetrics.exception.AiEvaluationException;
import com.team.issuemetrics.exception.RateLimitExceededException;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Service for calling Claude API via Anthropic's Messages API.
 * HTTP 429 and an exhausted local bucket both surface as {@link RateLimitExceededException};
 * every other failure surfaces as {@link AiEvaluationException}.
 */
@Service
@Slf4j
public class ClaudeApiService {

    private static final String ANTHROPIC_API_URL = "https://api.anthropic.com/v1/messages";
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    private final ClaudeApiConfig config;
    private final Bucket rateLimiter;
    private final WebClient webClient;

    @Autowired
    public ClaudeApiService(ClaudeApiConfig config,
                            @Qualifier("claudeApiRateLimiter") Bucket rateLimiter) {
        this(config, rateLimiter, WebClient.builder()
                .baseUrl(ANTHROPIC_API_URL)
                .defaultHeader("x-api-key", requireApiKey(config))
                .defaultHeader("anthropic-version", ANTHROPIC_VERSION)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build());
    }

    ClaudeApiService(ClaudeApiConfig config, Bucket rateLimiter, WebClient webClient) {
        this.config = config;
        this.rateLimiter = rateLimiter;
        this.webClient = webClient;
    }

    /**
     * Send a prompt to Claude API and get the response text.
     */
    public Mono<String> generate(String prompt) {
        if (!rateLimiter.tryConsume(1)) {
            log.warn("Claude API 本地 rate limit 已用完，暫停呼叫");
            return Mono.error(new RateLimitExceededException("Local rate limit exceeded for Claude API"));
        }

        Map<String, Object> requestBody = Map.of(
                "model", config.getModel(),
                "max_tokens", config.getMaxTokens(),
                "temperature", config.getTemperature(),
                "messages", List.of(
                        Map.of("role", "user", "content", prompt)
                )
        );

        log.debug("Calling Claude API with model: {}", config.getModel());

        return webClient.post()
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .map(this::extractResponseText)
                .onErrorMap(this::translateError)
                .doOnSuccess(response -> log.debug("Claude API response received ({} chars)", response.length()))
                .doOnError(error -> log.warn("Claude API call failed: {}", error.getMessage()));
    }

    private Throwable translateError(Throwable error) {
        if (error instanceof RateLimitExceededException || error instanceof AiEvaluationException) {
            return error;
        }
        if (error instanceof WebClientResponseException
                && ((WebClientResponseException) error).getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new RateLimitExceededException("Claude API returned 429 Too Many Requests", error);
        }
        return new AiEvaluationException("Claude API call failed: " + error.getMessage(), error);
    }

    @SuppressWarnings("unchecked")
    private String extractResponseText(Map<String, Object> response) {
        List<Map<String, Object>> content = (List<Map<String, Object>>) response.get("content");
        if (content == null || content.isEmpty()) {
            throw new AiEvaluationException("Empty response from Claude API");
        }
        Object text = content.get(0).get("text");
        if (text == null) {
            throw new AiEvaluationException("Claude API response has no text content");
        }
        return text.toString();
    }

    private static String requireApiKey(ClaudeApiConfig config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("claude.api-key is not configured");
        }
        return config.getApiKey();
    }
}
