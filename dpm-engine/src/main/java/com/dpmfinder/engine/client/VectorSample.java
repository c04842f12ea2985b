package com.dpmfinder.engine.client;

import java.util.Map;

/**
 * One element of an instant-query result: the series label set and its sample value.
 * Scalar results are represented as a single sample with no labels.
 */
public record VectorSample(Map<String, String> labels, double value) {

    public VectorSample {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
