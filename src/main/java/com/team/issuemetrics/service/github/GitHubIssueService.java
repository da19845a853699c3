package com.team.issuemetrics.service.github;

import com.team.issuemetrics.config.GitHubConfig;
import com.team.issuemetrics.exception.IssueTrackerException;
import com.team.issuemetrics.model.github.GitHubIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * GitHub Issue 列表（分頁）。
 * issues API 同時會回傳 PR，這裡一律濾掉。
 */
@Service
@Slf4j
public class GitHubIssueService {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_LIST =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final GitHubConfig config;

    public GitHubIssueService(@Qualifier("githubWebClient") WebClient webClient, GitHubConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    /**
     * 取得 Issue 列表。
     *
     * @param since null 表示全量；否則只取此時間之後有更新的 Issue
     */
    public Mono<List<GitHubIssue>> listIssues(String owner, String repo, Instant since) {
        log.info("取得 GitHub Issue：{}/{} since={}", owner, repo, since != null ? since : "(全量)");

        return fetchPage(owner, repo, since, 1)
                .expand(page -> page.last() ? Mono.empty() : fetchPage(owner, repo, since, page.number() + 1))
                .flatMapIterable(Page::items)
                .filter(issue -> !issue.isPullRequest())
                .collectList()
                .doOnSuccess(issues -> log.info("取得 {}/{} 的 Issue {} 筆", owner, repo, issues.size()))
                .onErrorMap(e -> !(e instanceof IssueTrackerException),
                        e -> new IssueTrackerException(
                                "Failed to list issues for " + owner + "/" + repo + ": " + e.getMessage(), e));
    }

    private Mono<Page> fetchPage(String owner, String repo, Instant since, int page) {
        int pageSize = config.getPageSize();

        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path("/repos/{owner}/{repo}/issues")
                            .queryParam("state", "all")
                            .queryParam("sort", "updated")
                            .queryParam("direction", "desc")
                            .queryParam("per_page", pageSize)
                            .queryParam("page", page);
                    if (since != null) {
                        uriBuilder.queryParam("since", since.toString());
                    }
                    return uriBuilder.build(owner, repo);
                })
                .retrieve()
                .bodyToMono(JSON_LIST)
                .defaultIfEmpty(List.of())
                .map(raw -> {
                    log.debug("Issue 第 {} 頁：{} 筆", page, raw.size());
                    // 是否為最後一頁要看原始筆數（濾掉 PR 之前）
                    return new Page(page, raw.stream().map(GitHubMappings::toIssue).toList(), raw.size() < pageSize);
                });
    }

    private record Page(int number, List<GitHubIssue> items, boolean last) {
    }
}
