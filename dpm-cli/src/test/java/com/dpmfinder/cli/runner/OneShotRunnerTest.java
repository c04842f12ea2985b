package com.dpmfinder.cli.runner;

import com.dpmfinder.cli.config.CliOptions;
import com.dpmfinder.cli.writer.CsvReportWriter;
import com.dpmfinder.cli.writer.JsonReportWriter;
import com.dpmfinder.cli.writer.OutputFormat;
import com.dpmfinder.cli.writer.PromReportWriter;
import com.dpmfinder.cli.writer.ReportWriter;
import com.dpmfinder.cli.writer.TextReportWriter;
import com.dpmfinder.common.exception.CycleAbortedException;
import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.CycleStatistics;
import com.dpmfinder.common.model.MetricRateResult;
import com.dpmfinder.common.selection.SelectionCriteria;
import com.dpmfinder.engine.cycle.CycleOptions;
import com.dpmfinder.engine.cycle.CycleRunner;
import com.dpmfinder.engine.rate.RateOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OneShotRunnerTest {

    private static final List<ReportWriter> WRITERS = List.of(new CsvReportWriter(), new TextReportWriter(),
        new JsonReportWriter(new ObjectMapper()), new PromReportWriter());

    private static final CycleReport REPORT = new CycleReport(
        List.of(MetricRateResult.of("http_requests_total", 120), MetricRateResult.of("custom_metric", 4)),
        List.of(),
        Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:01Z"),
        CycleStatistics.of(3, 2, 2, 0, 2, 10, Duration.ofSeconds(1), Duration.ofMillis(400)));

    @TempDir
    Path dir;

    private CycleRunner cycleRunner;
    private ByteArrayOutputStream stdout;

    @BeforeEach
    void setUp() {
        cycleRunner = mock(CycleRunner.class);
        when(cycleRunner.options()).thenReturn(
            new CycleOptions(RateOptions.defaults(), SelectionCriteria.threshold(1.0), 10));
        stdout = new ByteArrayOutputStream();
    }

    private OneShotRunner runner(CliOptions options) {
        return new OneShotRunner(cycleRunner, WRITERS, options,
            new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("writes metric_rates.csv and echoes it")
    void writesAndEchoes() throws IOException {
        when(cycleRunner.runCycle()).thenReturn(Mono.just(REPORT));
        OneShotRunner runner = runner(new CliOptions(OutputFormat.CSV, dir, false, true));

        runner.run();

        String expected = "metric_name,dpm\nhttp_requests_total,120.0\ncustom_metric,4.0\n";
        assertThat(runner.getExitCode()).isZero();
        assertThat(Files.readString(dir.resolve("metric_rates.csv"))).isEqualTo(expected);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo(expected);
    }

    @Test
    @DisplayName("quiet mode writes the file without echoing")
    void quiet() {
        when(cycleRunner.runCycle()).thenReturn(Mono.just(REPORT));
        OneShotRunner runner = runner(new CliOptions(OutputFormat.PROM, dir, true, true));

        runner.run();

        assertThat(runner.getExitCode()).isZero();
        assertThat(dir.resolve("metric_rates.prom")).exists();
        assertThat(stdout.size()).isZero();
    }

    @Test
    @DisplayName("creates a missing output directory")
    void createsOutputDir() {
        when(cycleRunner.runCycle()).thenReturn(Mono.just(REPORT));
        Path nested = dir.resolve("reports/daily");

        runner(new CliOptions(OutputFormat.JSON, nested, false, false)).run();

        assertThat(nested.resolve("metric_rates.json")).exists();
    }

    @Test
    @DisplayName("exits 1 without a report when discovery fails")
    void abortedCycle() {
        when(cycleRunner.runCycle()).thenReturn(
            Mono.error(new CycleAbortedException("Metric discovery failed: 401", null)));
        OneShotRunner runner = runner(new CliOptions(OutputFormat.CSV, dir, false, true));

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(dir.resolve("metric_rates.csv")).doesNotExist();
        assertThat(stdout.size()).isZero();
    }

    @Test
    @DisplayName("exits 2 when the report cannot be written")
    void outputFailure() throws IOException {
        when(cycleRunner.runCycle()).thenReturn(Mono.just(REPORT));
        Path notADirectory = Files.writeString(dir.resolve("occupied"), "x");

        OneShotRunner runner = runner(new CliOptions(OutputFormat.TEXT, notADirectory, false, true));
        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(2);
        assertThat(stdout.size()).isZero();
    }
}
