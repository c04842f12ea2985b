package com.dpmfinder.engine.config;

import com.dpmfinder.common.retry.BackoffPolicy;
import com.dpmfinder.engine.client.PrometheusQueryClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Wires the backend {@link WebClient}: basic auth, connect/read timeouts, request logging.
 * Retries are not done here; {@link PrometheusQueryClient} owns them.
 */
@Configuration
public class BackendClientConfig {

    private static final Logger log = LoggerFactory.getLogger(BackendClientConfig.class);

    /** Label-value listings of large tenants run to tens of megabytes. */
    private static final int MAX_RESPONSE_BYTES = 64 * 1024 * 1024;

    @Value("${dpm.backend.base-url:http://localhost:9090}")
    private String baseUrl;

    @Value("${dpm.backend.username:}")
    private String username;

    @Value("${dpm.backend.api-key:}")
    private String apiKey;

    @Value("${dpm.backend.api-prefix:/api/prom}")
    private String apiPrefix;

    @Value("${dpm.backend.rules-path:/aggregations/rules}")
    private String rulesPath;

    @Value("${dpm.backend.timeout-seconds:60}")
    private int timeoutSeconds;

    @Value("${dpm.backend.max-attempts:10}")
    private int maxAttempts;

    @Value("${dpm.backend.backoff-base-millis:2000}")
    private long backoffBaseMillis;

    @Value("${dpm.backend.backoff-max-millis:60000}")
    private long backoffMaxMillis;

    @Bean
    public WebClient backendWebClient(WebClient.Builder builder) {
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("dpm.backend.timeout-seconds must be at least 1, got " + timeoutSeconds);
        }
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        WebClient.Builder configured = builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build())
            .filter(loggingFilter());

        if (!username.isBlank() || !apiKey.isBlank()) {
            configured.defaultHeaders(h -> h.setBasicAuth(username, apiKey));
        } else {
            log.warn("BACKEND_AUTH_MISSING baseUrl={}, requests are sent without credentials", baseUrl);
        }
        return configured.build();
    }

    @Bean
    public BackoffPolicy backendBackoffPolicy() {
        return new BackoffPolicy(maxAttempts,
            Duration.ofMillis(backoffBaseMillis), Duration.ofMillis(backoffMaxMillis));
    }

    @Bean
    public PrometheusQueryClient prometheusQueryClient(WebClient backendWebClient, ObjectMapper objectMapper,
                                                       BackoffPolicy backendBackoffPolicy) {
        log.info("BACKEND_CLIENT baseUrl={} apiPrefix={} rulesPath={} timeoutSeconds={} maxAttempts={}",
                 baseUrl, apiPrefix, rulesPath, timeoutSeconds, maxAttempts);
        return new PrometheusQueryClient(backendWebClient, objectMapper, apiPrefix, rulesPath,
            Duration.ofSeconds(timeoutSeconds), backendBackoffPolicy);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
