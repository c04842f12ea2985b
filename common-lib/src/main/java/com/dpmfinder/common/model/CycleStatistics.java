package com.dpmfinder.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Counts and timing figures of one discovery → filter → compute → select pass.
 *
 * <p>{@code processed} is the number of metrics dispatched (discovered minus filtered
 * out) and always equals {@code succeeded + failed}. {@code selected} is how many
 * results survived the threshold, label and top-N selection.
 */
public record CycleStatistics(
    @JsonProperty("discovered") int discovered,
    @JsonProperty("filteredOut") int filteredOut,
    @JsonProperty("processed") int processed,
    @JsonProperty("succeeded") int succeeded,
    @JsonProperty("failed") int failed,
    @JsonProperty("selected") int selected,
    @JsonProperty("effectiveWorkers") int effectiveWorkers,
    @JsonIgnore Duration totalRuntime,
    @JsonIgnore Duration averageMetricTime
) {

    public static CycleStatistics of(int discovered, int processed, int succeeded, int failed,
                                     int selected, int workers,
                                     Duration totalRuntime, Duration cumulativeMetricTime) {
        Duration average = processed > 0 ? cumulativeMetricTime.dividedBy(processed) : Duration.ZERO;
        return new CycleStatistics(discovered, discovered - processed, processed, succeeded, failed,
            selected, Math.min(Math.max(1, workers), Math.max(1, processed)), totalRuntime, average);
    }

    @JsonProperty("totalRuntimeSeconds")
    public double totalRuntimeSeconds() {
        return totalRuntime.toNanos() / 1_000_000_000.0;
    }

    @JsonProperty("averageMetricSeconds")
    public double averageMetricSeconds() {
        return averageMetricTime.toNanos() / 1_000_000_000.0;
    }

    /** Metrics per second over the whole cycle; 0 when the cycle took no measurable time. */
    @JsonProperty("metricsPerSecond")
    public double metricsPerSecond() {
        double seconds = totalRuntimeSeconds();
        return seconds > 0 ? processed / seconds : 0.0;
    }
}
