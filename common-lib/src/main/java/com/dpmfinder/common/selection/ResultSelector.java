package com.dpmfinder.common.selection;

import com.dpmfinder.common.model.MetricRateResult;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Threshold → label filter → sort → top-N, in that order.
 *
 * <p>The label filter only inspects results that carry labels. Results without labels
 * pass through unchanged, so a label filter is meaningful only when label enrichment
 * ran upstream; the engine refuses that configuration at startup. A label whose value
 * differs between a metric's series is not part of its label set, so an exact filter
 * on that label never matches the metric.
 *
 * <p>The output order is fully determined by the input set: ties in DPM break on the
 * metric name, so selecting the same input twice yields the same list.
 */
public final class ResultSelector {

    static final Comparator<MetricRateResult> BY_DPM_DESC =
        Comparator.comparingDouble(MetricRateResult::dpm).reversed()
            .thenComparing(MetricRateResult::name);

    static final Comparator<MetricRateResult> BY_NAME =
        Comparator.comparing(MetricRateResult::name);

    private ResultSelector() {}

    public static List<MetricRateResult> select(List<MetricRateResult> results, SelectionCriteria criteria) {
        Stream<MetricRateResult> stream = results.stream()
            .filter(r -> r.dpm() > criteria.minDpm());

        if (criteria.hasLabelFilter()) {
            LabelMatcher matcher = criteria.labelMatcher();
            stream = stream.filter(r -> !r.hasLabels() || matcher.matches(r.labels()));
        }

        stream = stream.sorted(criteria.sortBy() == SortKey.NAME ? BY_NAME : BY_DPM_DESC);

        if (criteria.topN() > 0) {
            stream = stream.limit(criteria.topN());
        }
        return stream.toList();
    }
}
