package com.dpmfinder.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one completed cycle. {@code results} is already selected and
 * ordered; {@code failures} lists every metric that could not be evaluated.
 *
 * <p>Both lists are defensively copied, so a published report can be handed to any
 * number of readers while the next cycle runs.
 */
public record CycleReport(
    @JsonProperty("results") List<MetricRateResult> results,
    @JsonProperty("failures") List<FailureRecord> failures,
    @JsonProperty("startedAt") Instant startedAt,
    @JsonProperty("finishedAt") Instant finishedAt,
    @JsonProperty("statistics") CycleStatistics statistics
) {

    public CycleReport {
        results  = List.copyOf(results);
        failures = List.copyOf(failures);
    }
}
