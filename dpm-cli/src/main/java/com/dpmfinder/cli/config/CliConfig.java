package com.dpmfinder.cli.config;

import com.dpmfinder.cli.writer.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class CliConfig {

    private static final Logger log = LoggerFactory.getLogger(CliConfig.class);

    @Value("${dpm.cli.format:csv}")
    private String format;

    @Value("${dpm.cli.output-dir:.}")
    private String outputDir;

    @Value("${dpm.cli.quiet:false}")
    private boolean quiet;

    @Value("${dpm.cli.echo:true}")
    private boolean echo;

    @Bean
    public CliOptions cliOptions(LoggingSystem loggingSystem) {
        CliOptions options = new CliOptions(OutputFormat.parse(format), Path.of(outputDir), quiet, echo);
        if (quiet) {
            // only errors from here on
            loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, LogLevel.ERROR);
        } else {
            log.info("CLI_OPTIONS format={} outputFile={} echo={}",
                     options.format(), options.outputFile(), options.echo());
        }
        return options;
    }
}
