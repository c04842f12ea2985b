package com.dpmfinder.engine.cycle;

import com.dpmfinder.common.selection.SelectionCriteria;
import com.dpmfinder.engine.rate.RateOptions;

/**
 * Everything a cycle needs besides its collaborators.
 *
 * <p>A label filter only has something to inspect when label enrichment runs, so that
 * combination is rejected here rather than silently passing every metric.
 */
public record CycleOptions(RateOptions rate, SelectionCriteria selection, int threads) {

    public CycleOptions {
        threads = Math.max(1, threads);
        if (selection.hasLabelFilter() && !rate.withLabels()) {
            throw new IllegalStateException(
                "Label filter '" + selection.labelMatcher() + "' requires label enrichment (dpm.rate.labels=true)");
        }
    }
}
