package com.dpmfinder.engine.dispatch;

import com.dpmfinder.common.model.FailureRecord;
import com.dpmfinder.common.model.MetricRateResult;

import java.time.Duration;
import java.util.List;

/**
 * Fan-in of one {@link ConcurrentDispatcher#run} call. Every dispatched name appears
 * exactly once, either in {@code results} or in {@code failures}. Order is whatever
 * the workers finished in.
 *
 * @param cumulativeMetricTime sum of per-metric evaluation times across all workers
 */
public record DispatchResult(
    List<MetricRateResult> results,
    List<FailureRecord> failures,
    Duration cumulativeMetricTime,
    int workers
) {

    public DispatchResult {
        results  = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public int processed() {
        return results.size() + failures.size();
    }
}
