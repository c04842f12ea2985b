package com.dpmfinder.cli.writer;

import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.CycleStatistics;
import com.dpmfinder.common.model.MetricRateResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

import static com.dpmfinder.cli.writer.ReportWriter.round;

/**
 * <pre>
 * {
 *   "metrics": [ { "metric_name": ..., "dpm": ... }, ... ],
 *   "total_metrics_above_threshold": n,
 *   "performance_metrics": { ... }
 * }
 * </pre>
 * Optional per-metric fields ({@code active_series}, {@code impact_score},
 * {@code labels}) are only present when they were queried.
 */
@Component
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public void write(CycleReport report, Writer out) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode metrics = root.putArray("metrics");
        for (MetricRateResult r : report.results()) {
            ObjectNode metric = metrics.addObject();
            metric.put("metric_name", r.name());
            metric.put("dpm", r.dpm());
            if (r.activeSeries() != null) {
                metric.put("active_series", r.activeSeries());
                metric.put("impact_score", r.impactScore());
            }
            if (r.hasLabels()) {
                ObjectNode labels = metric.putObject("labels");
                r.labels().forEach(labels::put);
            }
        }
        root.put("total_metrics_above_threshold", report.results().size());

        CycleStatistics stats = report.statistics();
        ObjectNode performance = root.putObject("performance_metrics");
        performance.put("total_runtime_seconds", round(stats.totalRuntimeSeconds(), 2));
        performance.put("average_metric_processing_seconds", round(stats.averageMetricSeconds(), 3));
        performance.put("total_metrics_processed", stats.processed());
        performance.put("failed_metrics", stats.failed());
        performance.put("metrics_per_second", round(stats.metricsPerSecond(), 1));

        // writeValue(Writer, ...) would close the caller's writer
        out.write(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root));
        out.write('\n');
    }
}
