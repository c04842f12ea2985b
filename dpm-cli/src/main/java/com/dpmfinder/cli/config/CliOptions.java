package com.dpmfinder.cli.config;

import com.dpmfinder.cli.writer.OutputFormat;

import java.nio.file.Path;

/**
 * @param quiet suppresses progress logging and the stdout echo
 * @param echo  prints the rendered report to stdout after writing the file
 */
public record CliOptions(OutputFormat format, Path outputDir, boolean quiet, boolean echo) {

    public boolean shouldEcho() {
        return echo && !quiet;
    }

    public Path outputFile() {
        return outputDir.resolve(format.fileName());
    }
}
