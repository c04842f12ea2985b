package com.dpmfinder.engine.rate;

/**
 * Per-cycle knobs of {@link RateCalculator}.
 *
 * @param windowMinutes       width of the sampled window; DPM = points in window / windowMinutes
 * @param withSeriesCount     also query the active series count and derive the impact score
 * @param withLabels          also enumerate the metric's label sets
 * @param ignoreUsageSelector select {@code {__ignore_usage__=""}} so analysis queries stay out of usage accounting
 */
public record RateOptions(int windowMinutes, boolean withSeriesCount, boolean withLabels, boolean ignoreUsageSelector) {

    public static final int DEFAULT_WINDOW_MINUTES = 5;

    public RateOptions {
        if (windowMinutes < 1) {
            throw new IllegalArgumentException("windowMinutes must be >= 1, got " + windowMinutes);
        }
    }

    public static RateOptions defaults() {
        return new RateOptions(DEFAULT_WINDOW_MINUTES, false, false, true);
    }
}
