package com.team.issuemetrics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@ConfigurationProperties(prefix = "github")
@Getter
@Setter
public class GitHubConfig {

    private String pat;
    private String baseUrl = "https://api.github.com";

    /** 每頁筆數，回傳筆數少於此值即視為最後一頁 */
    private int pageSize = 100;

    /** 一致性評估時 PR patch 的字元上限 */
    private int maxPatchLength = 5000;

    @Bean(name = "githubWebClient")
    public WebClient githubWebClient() {
        if (pat == null || pat.isBlank()) {
            throw new IllegalStateException("github.pat is not configured");
        }

        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + pat)
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                // timeline / files 的回應可能很大
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                        .build())
                .build();
    }
}
