package com.dpmfinder.engine.client;

import com.dpmfinder.common.retry.BackoffPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory backend for client tests: every request is recorded and answered by
 * {@code responder}, which sees the decoded path + query.
 */
public final class StubBackend {

    public final List<String> requests = new CopyOnWriteArrayList<>();
    public final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private final Function<String, Mono<ClientResponse>> responder;

    public StubBackend(Function<String, Mono<ClientResponse>> responder) {
        this.responder = responder;
    }

    public WebClient webClient() {
        return WebClient.builder()
            .baseUrl("http://backend.test")
            .defaultHeaders(h -> h.setBasicAuth("tenant", "secret"))
            .exchangeFunction(this::exchange)
            .build();
    }

    public PrometheusQueryClient client(int maxAttempts, Duration timeout) {
        return new PrometheusQueryClient(webClient(), new ObjectMapper(), "/api/prom", "/aggregations/rules",
            timeout, new BackoffPolicy(maxAttempts, Duration.ofMillis(1), Duration.ofMillis(5)));
    }

    private Mono<ClientResponse> exchange(ClientRequest request) {
        URI uri = request.url();
        String target = uri.getRawPath() + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());
        String decoded = URLDecoder.decode(target, StandardCharsets.UTF_8);
        requests.add(decoded);
        authHeaders.add(request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        return responder.apply(decoded);
    }

    public static Mono<ClientResponse> json(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    public static Mono<ClientResponse> emptyBody() {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build());
    }

    public static Mono<ClientResponse> status(HttpStatus status) {
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body("{\"status\":\"error\",\"error\":\"" + status.getReasonPhrase() + "\"}")
            .build());
    }

    public static String vector(String metric, String value) {
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
            + "{\"metric\":{\"__name__\":\"" + metric + "\"},\"value\":[1700000000.0,\"" + value + "\"]}]}}";
    }

    public static String emptyVector() {
        return "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":[]}}";
    }
}
