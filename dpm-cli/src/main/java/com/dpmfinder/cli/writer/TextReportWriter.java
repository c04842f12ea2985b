package com.dpmfinder.cli.writer;

import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.CycleStatistics;
import com.dpmfinder.common.model.MetricRateResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.dpmfinder.cli.writer.ReportWriter.number;

@Component
public class TextReportWriter implements ReportWriter {

    @Override
    public OutputFormat format() {
        return OutputFormat.TEXT;
    }

    @Override
    public void write(CycleReport report, Writer out) throws IOException {
        out.write("Metrics and their DPM values:\n");
        for (MetricRateResult r : report.results()) {
            StringBuilder line = new StringBuilder(r.name()).append(": ").append(number(r.dpm()));
            if (r.activeSeries() != null) {
                line.append(" (active_series=").append(r.activeSeries())
                    .append(", impact_score=").append(number(r.impactScore())).append(')');
            }
            if (r.hasLabels() && !r.labels().isEmpty()) {
                line.append(' ').append(formatLabels(r.labels()));
            }
            out.write(line.append('\n').toString());
        }

        CycleStatistics stats = report.statistics();
        out.write("\nPerformance Metrics:\n");
        out.write(String.format(Locale.ROOT, "Total runtime: %.2f seconds\n", stats.totalRuntimeSeconds()));
        out.write(String.format(Locale.ROOT, "Average time per metric: %.3f seconds\n", stats.averageMetricSeconds()));
        out.write("Total metrics processed: " + stats.processed() + "\n");
        out.write("Failed metrics: " + stats.failed() + "\n");
        out.write(String.format(Locale.ROOT, "Metrics processing rate: %.1f metrics/second\n",
            stats.metricsPerSecond()));
    }

    private static String formatLabels(Map<String, String> labels) {
        return new TreeMap<>(labels).entrySet().stream()
            .map(e -> e.getKey() + "=\"" + e.getValue() + "\"")
            .collect(Collectors.joining(",", "{", "}"));
    }
}
