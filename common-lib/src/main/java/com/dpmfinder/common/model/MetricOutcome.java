package com.dpmfinder.common.model;

import java.time.Duration;

/**
 * Either a {@link MetricRateResult} or a {@link FailureRecord} for one metric name,
 * never both. {@code elapsed} is the wall time spent evaluating the metric.
 */
public record MetricOutcome(
    String name,
    MetricRateResult result,
    FailureRecord failure,
    Duration elapsed
) {

    public MetricOutcome {
        if ((result == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of result/failure must be set for " + name);
        }
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static MetricOutcome success(MetricRateResult result) {
        return new MetricOutcome(result.name(), result, null, Duration.ZERO);
    }

    public static MetricOutcome failure(FailureRecord failure) {
        return new MetricOutcome(failure.name(), null, failure, Duration.ZERO);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public MetricOutcome withElapsed(Duration took) {
        return new MetricOutcome(name, result, failure, took);
    }
}
