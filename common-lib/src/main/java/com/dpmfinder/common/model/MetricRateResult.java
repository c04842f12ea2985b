package com.dpmfinder.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Ingestion rate of one metric, as measured over the rate window of a single cycle.
 *
 * <p>{@code activeSeries} and {@code impactScore} are either both present or both
 * {@code null}: the impact score only exists when the series count was queried.
 * {@code labels} is {@code null} unless label enrichment was requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricRateResult(
    @JsonProperty("metricName") String name,
    @JsonProperty("dpm") double dpm,
    @JsonProperty("activeSeries") Long activeSeries,
    @JsonProperty("impactScore") Double impactScore,
    @JsonProperty("labels") Map<String, String> labels
) {

    public MetricRateResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("metric name must not be blank");
        }
        if (dpm < 0 || Double.isNaN(dpm)) {
            throw new IllegalArgumentException("dpm must be >= 0, got " + dpm + " for " + name);
        }
        labels = labels == null ? null : Map.copyOf(labels);
    }

    public static MetricRateResult of(String name, double dpm) {
        return new MetricRateResult(name, dpm, null, null, null);
    }

    /** Returns a copy carrying the active series count and the derived impact score. */
    public MetricRateResult withActiveSeries(long series) {
        return new MetricRateResult(name, dpm, series, dpm * series, labels);
    }

    public MetricRateResult withLabels(Map<String, String> labelSet) {
        return new MetricRateResult(name, dpm, activeSeries, impactScore, labelSet);
    }

    public boolean hasLabels() {
        return labels != null;
    }
}
