package com.dpmfinder.engine.client;

import com.dpmfinder.common.exception.BackendQueryException;
import com.dpmfinder.common.retry.BackoffPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only client for the three backend request shapes the engine consumes:
 * <ul>
 *   <li>{@code GET {prefix}/api/v1/label/__name__/values}: the metric universe</li>
 *   <li>{@code GET {rulesPath}}: aggregation rules, a JSON array of {@code {"metric": ...}} objects</li>
 *   <li>{@code GET {prefix}/api/v1/query?query=...}: instant vector/scalar queries</li>
 * </ul>
 *
 * <p>Every call gets the per-request timeout and the retry policy. Transient failures
 * (timeouts, network errors, 429, 5xx) are retried with exponential backoff; anything
 * else fails on the first attempt. Failures always surface as
 * {@link BackendQueryException} stamped with the attempt count.
 *
 * <p>Holds no per-call state, so one instance is shared by all workers.
 */
public class PrometheusQueryClient {

    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiPrefix;
    private final String rulesPath;
    private final Duration timeout;
    private final BackoffPolicy backoff;

    public PrometheusQueryClient(WebClient backendWebClient, ObjectMapper objectMapper,
                                 String apiPrefix, String rulesPath,
                                 Duration timeout, BackoffPolicy backoff) {
        this.webClient    = backendWebClient;
        this.objectMapper = objectMapper;
        this.apiPrefix    = normalizePrefix(apiPrefix);
        this.rulesPath    = rulesPath;
        this.timeout      = timeout;
        this.backoff      = backoff;
    }

    public Mono<List<String>> listMetricNames() {
        String path = apiPrefix + "/api/v1/label/__name__/values";
        return execute("metric-names",
            webClient.get().uri(path).retrieve().bodyToMono(String.class),
            root -> {
                JsonNode data = successData(root, "metric-names");
                if (!data.isArray()) {
                    throw BackendQueryException.malformed("metric-names", "'data' is not an array", null);
                }
                List<String> names = new ArrayList<>(data.size());
                data.forEach(n -> names.add(n.asText()));
                return names;
            })
            .doOnSuccess(names -> log.info("METRICS_DISCOVERED count={}", names.size()));
    }

    public Mono<Set<String>> listAggregationRuleNames() {
        return execute("aggregation-rules",
            webClient.get().uri(rulesPath).retrieve().bodyToMono(String.class),
            root -> {
                JsonNode rules = root.isArray() ? root : root.path("data");
                if (!rules.isArray()) {
                    throw BackendQueryException.malformed("aggregation-rules", "rules body is not an array", null);
                }
                Set<String> names = new LinkedHashSet<>();
                rules.forEach(rule -> {
                    JsonNode metric = rule.path("metric");
                    if (metric.isTextual()) names.add(metric.asText());
                });
                return names;
            })
            .doOnSuccess(names -> log.info("AGGREGATION_RULES_LOADED count={}", names.size()));
    }

    public Mono<List<VectorSample>> instantQuery(String expression) {
        String path = apiPrefix + "/api/v1/query";
        String description = "query[" + expression + "]";
        return execute(description,
            webClient.get()
                .uri(uriBuilder -> uriBuilder.path(path).queryParam("query", "{query}").build(expression))
                .retrieve()
                .bodyToMono(String.class),
            root -> parseQueryResult(successData(root, description), description));
    }

    // ── shared pipeline ──────────────────────────────────────────────────────

    private <T> Mono<T> execute(String description, Mono<String> call, Function<JsonNode, T> parser) {
        return Mono.defer(() -> call)
            .timeout(timeout)
            .onErrorMap(e -> BackendErrors.classify(e, description))
            .switchIfEmpty(Mono.error(() -> BackendQueryException.malformed(description, "empty response body", null)))
            .map(body -> parser.apply(readTree(body, description)))
            .retryWhen(backoff.retrySpec(description,
                e -> e instanceof BackendQueryException bqe && bqe.isTransient(),
                (e, attempts) -> BackendErrors.classify(e, description).withAttempts(attempts)));
    }

    private JsonNode readTree(String body, String description) {
        if (body == null || body.isBlank()) {
            throw BackendQueryException.malformed(description, "empty response body", null);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw BackendQueryException.malformed(description, "response is not valid JSON", e);
        }
    }

    private static JsonNode successData(JsonNode root, String description) {
        String status = root.path("status").asText("");
        if (!"success".equals(status)) {
            throw BackendQueryException.malformed(description,
                "backend status '" + status + "': " + root.path("error").asText(""), null);
        }
        return root.path("data");
    }

    /**
     * Parses {@code data} of a query response. Vector results yield one sample per
     * series; scalar results yield one unlabeled sample; an empty vector yields an
     * empty list.
     */
    static List<VectorSample> parseQueryResult(JsonNode data, String description) {
        String resultType = data.path("resultType").asText("vector");
        JsonNode result = data.path("result");
        if ("scalar".equals(resultType)) {
            return List.of(new VectorSample(Map.of(), sampleValue(result, description)));
        }
        if (!result.isArray()) {
            throw BackendQueryException.malformed(description, "'result' is not an array", null);
        }
        List<VectorSample> samples = new ArrayList<>(result.size());
        for (JsonNode element : result) {
            Map<String, String> labels = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = element.path("metric").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                labels.put(f.getKey(), f.getValue().asText());
            }
            samples.add(new VectorSample(labels, sampleValue(element.path("value"), description)));
        }
        return samples;
    }

    // value is [ <unix ts>, "<number as string>" ]
    private static double sampleValue(JsonNode pair, String description) {
        if (!pair.isArray() || pair.size() < 2) {
            throw BackendQueryException.malformed(description, "sample value is not a [ts, value] pair", null);
        }
        String raw = pair.get(1).asText();
        if ("+Inf".equals(raw)) return Double.POSITIVE_INFINITY;
        if ("-Inf".equals(raw)) return Double.NEGATIVE_INFINITY;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw BackendQueryException.malformed(description, "sample value '" + raw + "' is not numeric", e);
        }
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank() || "/".equals(prefix)) return "";
        String p = prefix.startsWith("/") ? prefix : "/" + prefix;
        return p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }
}
