package com.team.issuemetrics.service.github;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 以「path + query」比對回傳固定 JSON 的 GitHub API 替身。沒有登錄的路徑回 404。
 */
class StubGitHub implements ExchangeFunction {

    private final Map<String, String> bodies = new HashMap<>();
    private final Map<String, HttpStatus> statuses = new HashMap<>();
    private final List<URI> requests = new ArrayList<>();

    StubGitHub respond(String pathAndQuery, String json) {
        bodies.put(pathAndQuery, json);
        return this;
    }

    StubGitHub fail(String pathAndQuery, HttpStatus status) {
        statuses.put(pathAndQuery, status);
        return this;
    }

    List<URI> requests() {
        return requests;
    }

    WebClient webClient() {
        return WebClient.builder()
                .baseUrl("https://api.github.com")
                .exchangeFunction(this)
                .build();
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        URI url = request.url();
        requests.add(url);
        String key = url.getQuery() != null ? url.getPath() + "?" + url.getQuery() : url.getPath();

        if (statuses.containsKey(key)) {
            return Mono.just(ClientResponse.create(statuses.get(key)).build());
        }
        String body = bodies.get(key);
        if (body == null) {
            return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
        }
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
