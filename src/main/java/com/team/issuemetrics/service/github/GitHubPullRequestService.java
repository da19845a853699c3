package com.team.issuemetrics.service.github;

import com.team.issuemetrics.config.GitHubConfig;
import com.team.issuemetrics.exception.IssueTrackerException;
import com.team.issuemetrics.model.evaluation.LinkedPullRequest;
import com.team.issuemetrics.model.github.ChangedFile;
import com.team.issuemetrics.model.github.GitHubPullRequest;
import com.team.issuemetrics.util.DiffParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GitHub Pull Request 相關 API：PR 列表、PR 詳細、Issue 關聯的已 merge PR。
 */
@Service
@Slf4j
public class GitHubPullRequestService {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final GitHubConfig config;
    private final DiffParser diffParser;

    public GitHubPullRequestService(@Qualifier("githubWebClient") WebClient webClient,
                                    GitHubConfig config,
                                    DiffParser diffParser) {
        this.webClient = webClient;
        this.config = config;
        this.diffParser = diffParser;
    }

    /**
     * 取得 PR 列表（依更新時間新到舊）。
     * pulls API 沒有 since 參數，所以在這裡過濾，遇到比 since 舊的資料就不再翻頁。
     */
    public Mono<List<GitHubPullRequest>> listPullRequests(String owner, String repo, Instant since) {
        log.info("取得 GitHub PR：{}/{} since={}", owner, repo, since != null ? since : "(全量)");

        return fetchPage(owner, repo, since, 1)
                .expand(page -> page.last() ? Mono.empty() : fetchPage(owner, repo, since, page.number() + 1))
                .flatMapIterable(Page::items)
                .collectList()
                .doOnSuccess(prs -> log.info("取得 {}/{} 的 PR {} 筆", owner, repo, prs.size()))
                .onErrorMap(e -> !(e instanceof IssueTrackerException),
                        e -> new IssueTrackerException(
                                "Failed to list pull requests for " + owner + "/" + repo + ": " + e.getMessage(), e));
    }

    /**
     * 取得 Issue 關聯且已 merge 的 PR（含 diff）。
     * 從 timeline 的 cross-referenced 事件找出引用此 Issue 的 PR。
     * 單一 PR 取得失敗只會略過該 PR；timeline 本身失敗則整個失敗。
     */
    public Mono<List<LinkedPullRequest>> listLinkedMergedPullRequests(String owner, String repo, int issueNumber) {
        return webClient.get()
                .uri("/repos/{owner}/{repo}/issues/{number}/timeline?per_page=100", owner, repo, issueNumber)
                .retrieve()
                .bodyToMono(JSON_LIST)
                .defaultIfEmpty(List.of())
                .onErrorMap(e -> new IssueTrackerException(
                        "Failed to read timeline of issue #" + issueNumber + ": " + e.getMessage(), e))
                .map(this::crossReferencedPullRequestNumbers)
                .flatMapMany(Flux::fromIterable)
                .concatMap(prNumber -> fetchLinkedPullRequest(owner, repo, prNumber)
                        .onErrorResume(e -> {
                            log.warn("取得 PR #{} 詳細失敗，略過：{}", prNumber, e.getMessage());
                            return Mono.empty();
                        }))
                .collectList()
                .doOnSuccess(prs -> log.debug("Issue #{} 關聯的已 merge PR：{} 筆", issueNumber, prs.size()));
    }

    public Mono<GitHubPullRequest> getPullRequest(String owner, String repo, int number) {
        return webClient.get()
                .uri("/repos/{owner}/{repo}/pulls/{number}", owner, repo, number)
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .map(GitHubMappings::toPullRequest);
    }

    public Mono<List<ChangedFile>> listFiles(String owner, String repo, int number) {
        return webClient.get()
                .uri("/repos/{owner}/{repo}/pulls/{number}/files?per_page=100", owner, repo, number)
                .retrieve()
                .bodyToMono(JSON_LIST)
                .defaultIfEmpty(List.of())
                .map(files -> files.stream().map(GitHubMappings::toChangedFile).toList());
    }

    private Mono<LinkedPullRequest> fetchLinkedPullRequest(String owner, String repo, int number) {
        return getPullRequest(owner, repo, number)
                .filter(GitHubPullRequest::isMerged)
                .flatMap(pr -> listFiles(owner, repo, number)
                        .map(files -> LinkedPullRequest.builder()
                                .number(pr.getNumber())
                                .title(pr.getTitle())
                                .url(pr.getHtmlUrl())
                                .body(pr.getBody())
                                .diffSummary(diffParser.diffSummary(files, config.getMaxPatchLength()))
                                .changedFiles(files.stream().map(ChangedFile::filename).toList())
                                .additions(pr.getAdditions())
                                .deletions(pr.getDeletions())
                                .mergedAt(pr.getMergedAt())
                                .build()));
    }

    @SuppressWarnings("unchecked")
    private List<Integer> crossReferencedPullRequestNumbers(List<Map<String, Object>> events) {
        Set<Integer> numbers = new LinkedHashSet<>();
        for (Map<String, Object> event : events) {
            if (!"cross-referenced".equals(event.get("event"))) continue;
            if (!(event.get("source") instanceof Map)) continue;
            Map<String, Object> source = (Map<String, Object>) event.get("source");
            if (!(source.get("issue") instanceof Map)) continue;
            Map<String, Object> issue = (Map<String, Object>) source.get("issue");
            // 一般 Issue 之間的互相引用沒有 pull_request 欄位
            if (issue.get("pull_request") == null) continue;
            numbers.add(GitHubMappings.intValue(issue.get("number")));
        }
        return List.copyOf(numbers);
    }

    private Mono<Page> fetchPage(String owner, String repo, Instant since, int page) {
        int pageSize = config.getPageSize();

        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/repos/{owner}/{repo}/pulls")
                        .queryParam("state", "all")
                        .queryParam("sort", "updated")
                        .queryParam("direction", "desc")
                        .queryParam("per_page", pageSize)
                        .queryParam("page", page)
                        .build(owner, repo))
                .retrieve()
                .bodyToMono(JSON_LIST)
                .defaultIfEmpty(List.of())
                .map(raw -> {
                    List<GitHubPullRequest> prs = raw.stream()
                            .map(GitHubMappings::toPullRequest)
                            .filter(pr -> since == null || !pr.getUpdatedAt().isBefore(since))
                            .toList();
                    // 依更新時間排序，出現比 since 舊的資料代表後面都更舊
                    boolean last = raw.size() < pageSize || prs.size() < raw.size();
                    log.debug("PR 第 {} 頁：{} 筆（符合 {} 筆）", page, raw.size(), prs.size());
                    return new Page(page, prs, last);
                });
    }

    private record Page(int number, List<GitHubPullRequest> items, boolean last) {
    }
}
