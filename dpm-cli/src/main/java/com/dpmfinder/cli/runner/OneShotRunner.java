package com.dpmfinder.cli.runner;

import com.dpmfinder.cli.config.CliOptions;
import com.dpmfinder.cli.writer.OutputFormat;
import com.dpmfinder.cli.writer.ReportWriter;
import com.dpmfinder.common.exception.CycleAbortedException;
import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.CycleStatistics;
import com.dpmfinder.engine.cycle.CycleRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs exactly one cycle and writes the report file.
 *
 * <p>Exit codes: {@code 0} report written, {@code 1} discovery failed and no report
 * was produced, {@code 2} the report file could not be written. Per-metric failures
 * do not change the exit code; they are counted in the report.
 */
@Component
public class OneShotRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(OneShotRunner.class);

    static final int EXIT_CYCLE_ABORTED = 1;
    static final int EXIT_OUTPUT_FAILED = 2;

    private final CycleRunner cycleRunner;
    private final List<ReportWriter> writers;
    private final CliOptions options;
    private final PrintStream stdout;

    private int exitCode;

    @Autowired
    public OneShotRunner(CycleRunner cycleRunner, List<ReportWriter> writers, CliOptions options) {
        this(cycleRunner, writers, options, System.out);
    }

    OneShotRunner(CycleRunner cycleRunner, List<ReportWriter> writers, CliOptions options, PrintStream stdout) {
        this.cycleRunner = cycleRunner;
        this.writers     = writers;
        this.options     = options;
        this.stdout      = stdout;
    }

    @Override
    public void run(String... args) {
        ReportWriter writer = writerFor(options.format());

        CycleReport report;
        try {
            report = cycleRunner.runCycle().block();
        } catch (CycleAbortedException e) {
            log.error("CYCLE_ABORTED reason={}", e.getMessage(), e);
            exitCode = EXIT_CYCLE_ABORTED;
            return;
        }

        Path file = options.outputFile();
        try {
            StringWriter rendered = new StringWriter();
            writer.write(report, rendered);
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Files.writeString(file, rendered.toString(), StandardCharsets.UTF_8);
            if (options.shouldEcho()) {
                stdout.print(rendered);
                stdout.flush();
            }
        } catch (IOException e) {
            log.error("REPORT_WRITE_FAILED file={} reason={}", file, e.getMessage(), e);
            exitCode = EXIT_OUTPUT_FAILED;
            return;
        }

        CycleStatistics stats = report.statistics();
        log.info("REPORT_WRITTEN file={} format={} selected={} failed={}",
                 file, options.format(), stats.selected(), stats.failed());
        log.info("Total number of metrics with DPM > {}: {}",
                 cycleRunner.options().selection().minDpm(), report.results().size());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private ReportWriter writerFor(OutputFormat format) {
        return writers.stream()
            .filter(w -> w.format() == format)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No report writer registered for " + format));
    }
}
