package com.dpmfinder.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A metric that could not be evaluated in a cycle. The metric is absent from the
 * result set of that cycle; the record only exists so the failure stays visible.
 */
public record FailureRecord(
    @JsonProperty("metricName") String name,
    @JsonProperty("kind") FailureKind kind,
    @JsonProperty("attempts") int attempts,
    @JsonProperty("message") String message
) {}
