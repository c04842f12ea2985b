package com.dpmfinder.cli.writer;

import com.dpmfinder.common.model.CycleReport;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders a {@link CycleReport} in one {@link OutputFormat}. Implementations only
 * write to the given {@link Writer}; choosing the file and echoing are the caller's job.
 */
public interface ReportWriter {

    OutputFormat format();

    void write(CycleReport report, Writer out) throws IOException;

    /** Plain decimal notation, never scientific. */
    static String number(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    static boolean hasSeries(CycleReport report) {
        return report.results().stream().anyMatch(r -> r.activeSeries() != null);
    }
}
