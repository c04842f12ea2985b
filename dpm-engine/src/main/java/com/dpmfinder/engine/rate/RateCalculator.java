package com.dpmfinder.engine.rate;

import com.dpmfinder.common.exception.BackendQueryException;
import com.dpmfinder.common.model.FailureRecord;
import com.dpmfinder.common.model.MetricOutcome;
import com.dpmfinder.common.model.MetricRateResult;
import com.dpmfinder.engine.client.PrometheusQueryClient;
import com.dpmfinder.engine.client.VectorSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Estimates the ingestion rate of one metric.
 *
 * <p><b>Primary query</b>:
 * <pre>
 *   count_over_time(name{__ignore_usage__=""}[5m]) / 5
 * </pre>
 * The first sample of the result is the DPM. An empty result is a legitimate
 * DPM of 0; a failed query is a {@link FailureRecord}. The two never mix.
 *
 * <p><b>Optional queries</b>, both non-fatal:
 * <ul>
 *   <li>series count: {@code count by (__name__) (name)}, impact score = DPM × series</li>
 *   <li>labels: the instant selector {@code name}, reduced to the labels every series shares</li>
 * </ul>
 */
public class RateCalculator {

    private static final Logger log = LoggerFactory.getLogger(RateCalculator.class);

    private static final String NAME_LABEL = "__name__";

    private final PrometheusQueryClient client;

    public RateCalculator(PrometheusQueryClient client) {
        this.client = client;
    }

    public Mono<MetricOutcome> computeRate(String name, RateOptions options) {
        String selector = selector(name, options);

        Mono<Double> dpm = client.instantQuery(dpmExpression(selector, options.windowMinutes()))
            .map(RateCalculator::firstValue);

        Mono<Optional<Long>> series = options.withSeriesCount()
            ? client.instantQuery(seriesCountExpression(selector))
                .map(samples -> samples.isEmpty()
                    ? Optional.<Long>empty()
                    : Optional.of((long) samples.get(0).value()))
                .onErrorResume(e -> optionalQueryFailed(name, "series-count", e))
            : Mono.just(Optional.empty());

        Mono<Optional<Map<String, String>>> labels = options.withLabels()
            ? client.instantQuery(selector)
                .map(samples -> Optional.of(sharedLabels(samples)))
                .onErrorResume(e -> optionalQueryFailed(name, "labels", e))
            : Mono.just(Optional.empty());

        return dpm
            .flatMap(value -> Mono.zip(series, labels)
                .map(extras -> {
                    MetricRateResult result = MetricRateResult.of(name, value);
                    if (extras.getT1().isPresent()) result = result.withActiveSeries(extras.getT1().get());
                    if (extras.getT2().isPresent()) result = result.withLabels(extras.getT2().get());
                    return MetricOutcome.success(result);
                }))
            .onErrorResume(BackendQueryException.class, e -> {
                log.warn("METRIC_FAILED metric={} kind={} attempts={} reason={}",
                         name, e.getKind(), e.getAttempts(), e.getMessage());
                return Mono.just(MetricOutcome.failure(
                    new FailureRecord(name, e.getKind(), e.getAttempts(), e.getMessage())));
            });
    }

    // ── expressions ───────────────────────────────────────────────────────────

    static String selector(String name, RateOptions options) {
        return options.ignoreUsageSelector() ? name + "{__ignore_usage__=\"\"}" : name;
    }

    static String dpmExpression(String selector, int windowMinutes) {
        return "count_over_time(" + selector + "[" + windowMinutes + "m])/" + windowMinutes;
    }

    static String seriesCountExpression(String selector) {
        return "count by (" + NAME_LABEL + ") (" + selector + ")";
    }

    // ── result handling ───────────────────────────────────────────────────────

    /** DPM from the first sample; empty, NaN or negative results count as 0. */
    static double firstValue(List<VectorSample> samples) {
        if (samples.isEmpty()) return 0.0;
        double v = samples.get(0).value();
        return Double.isNaN(v) || v < 0 ? 0.0 : v;
    }

    /**
     * Labels carried with the same value by every series of the metric. A series set
     * of {@code {job=api, instance=a}} and {@code {job=api, instance=b}} reduces to
     * {@code {job=api}}.
     */
    static Map<String, String> sharedLabels(List<VectorSample> samples) {
        if (samples.isEmpty()) return Map.of();
        Map<String, String> shared = new HashMap<>(samples.get(0).labels());
        shared.remove(NAME_LABEL);
        for (int i = 1; i < samples.size() && !shared.isEmpty(); i++) {
            Map<String, String> next = samples.get(i).labels();
            shared.entrySet().removeIf(e -> !e.getValue().equals(next.get(e.getKey())));
        }
        return shared;
    }

    private static <T> Mono<Optional<T>> optionalQueryFailed(String name, String query, Throwable e) {
        log.debug("OPTIONAL_QUERY_FAILED metric={} query={} reason={}", name, query, e.getMessage());
        return Mono.just(Optional.empty());
    }
}
