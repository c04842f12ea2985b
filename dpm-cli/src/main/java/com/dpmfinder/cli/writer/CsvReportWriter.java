package com.dpmfinder.cli.writer;

import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.MetricRateResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;

import static com.dpmfinder.cli.writer.ReportWriter.number;

/**
 * {@code metric_name,dpm} with {@code active_series,impact_score} appended when the
 * series count was queried. Metric names never contain commas, so no quoting is done.
 */
@Component
public class CsvReportWriter implements ReportWriter {

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public void write(CycleReport report, Writer out) throws IOException {
        boolean series = ReportWriter.hasSeries(report);
        out.write(series ? "metric_name,dpm,active_series,impact_score\n" : "metric_name,dpm\n");
        for (MetricRateResult r : report.results()) {
            out.write(r.name());
            out.write(',');
            out.write(number(r.dpm()));
            if (series) {
                out.write(',');
                out.write(r.activeSeries() == null ? "" : String.valueOf(r.activeSeries()));
                out.write(',');
                out.write(r.impactScore() == null ? "" : number(r.impactScore()));
            }
            out.write('\n');
        }
    }
}
