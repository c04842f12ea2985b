package com.dpmfinder.common.filter;

/** First rule of {@link MetricFilter} that matched a metric name, in evaluation order. */
public enum ExclusionReason {
    HISTOGRAM_SUFFIX,
    INTERNAL_PREFIX,
    AGGREGATION_RULE
}
