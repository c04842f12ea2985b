package com.dpmfinder.cli.writer;

import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.CycleStatistics;
import com.dpmfinder.common.model.MetricRateResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;

import static com.dpmfinder.cli.writer.ReportWriter.number;
import static com.dpmfinder.common.exposition.ExpositionNames.*;

/**
 * Prometheus text exposition of the report, using the same family names the
 * exporter publishes. Suitable for the node_exporter textfile collector.
 */
@Component
public class PromReportWriter implements ReportWriter {

    @Override
    public OutputFormat format() {
        return OutputFormat.PROM;
    }

    @Override
    public void write(CycleReport report, Writer out) throws IOException {
        perMetric(out, report, DPM_RATE, "Data points per minute for each metric", r -> r.dpm());
        if (ReportWriter.hasSeries(report)) {
            out.write('\n');
            perMetric(out, report, ACTIVE_SERIES, "Number of active time series for each metric",
                r -> r.activeSeries() == null ? null : r.activeSeries().doubleValue());
            out.write('\n');
            perMetric(out, report, IMPACT_SCORE, "DPM multiplied by active series count",
                MetricRateResult::impactScore);
        }

        CycleStatistics stats = report.statistics();
        single(out, RUNTIME_SECONDS, "Total runtime of the DPM finder", "gauge", stats.totalRuntimeSeconds());
        single(out, AVG_METRIC_SECONDS, "Average time to process each metric", "gauge",
            stats.averageMetricSeconds());
        single(out, METRICS_PROCESSED + "_total", "Total number of metrics processed", "counter",
            stats.processed());
        single(out, METRICS_FAILED, "Number of metrics that could not be evaluated", "gauge", stats.failed());
        single(out, PROCESSING_RATE, "Rate of metric processing", "gauge", stats.metricsPerSecond());
    }

    private static void perMetric(Writer out, CycleReport report, String family, String help,
                                  Function<MetricRateResult, Double> value) throws IOException {
        out.write("# HELP " + family + " " + help + "\n");
        out.write("# TYPE " + family + " gauge\n");
        Set<String> written = new LinkedHashSet<>();
        for (MetricRateResult r : report.results()) {
            Double v = value.apply(r);
            String label = sanitize(r.name());
            // first of two colliding sanitized names wins, duplicate series are invalid
            if (v == null || !written.add(label)) {
                continue;
            }
            out.write(family + "{" + METRIC_NAME_LABEL + "=\"" + label + "\"} " + number(v) + "\n");
        }
    }

    private static void single(Writer out, String name, String help, String type, double value)
            throws IOException {
        out.write("\n# HELP " + name + " " + help + "\n");
        out.write("# TYPE " + name + " " + type + "\n");
        out.write(name + " " + number(value) + "\n");
    }
}
