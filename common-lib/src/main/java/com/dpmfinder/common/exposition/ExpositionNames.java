package com.dpmfinder.common.exposition;

/**
 * Naming rules shared by the exporter gauges and the one-shot exposition report.
 */
public final class ExpositionNames {

    public static final String DPM_RATE            = "metric_dpm_rate";
    public static final String ACTIVE_SERIES       = "metric_active_series";
    public static final String IMPACT_SCORE        = "metric_impact_score";
    public static final String RUNTIME_SECONDS     = "dpm_finder_runtime_seconds";
    public static final String AVG_METRIC_SECONDS  = "dpm_finder_avg_metric_process_seconds";
    public static final String METRICS_PROCESSED   = "dpm_finder_metrics_processed";
    public static final String METRICS_FAILED      = "dpm_finder_metrics_failed";
    public static final String PROCESSING_RATE     = "dpm_finder_processing_rate_metrics_per_second";
    public static final String LAST_UPDATE         = "dpm_finder_last_update_timestamp";
    public static final String EXPORTER_INFO       = "dpm_finder_exporter_info";

    public static final String METRIC_NAME_LABEL   = "metric_name";

    private ExpositionNames() {}

    /** Replaces {@code -}, {@code .} and {@code :} with {@code _} for use as a label value. */
    public static String sanitize(String metricName) {
        return metricName.replace('-', '_').replace('.', '_').replace(':', '_');
    }
}
