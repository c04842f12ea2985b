package com.dpmfinder.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * One-shot entry point: runs a single cycle, writes {@code metric_rates.<ext>} and
 * exits with 0 on success, 1 if discovery failed, 2 if the report could not be written.
 */
@SpringBootApplication(scanBasePackages = "com.dpmfinder")
public class DpmFinderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DpmFinderApplication.class, args)));
    }
}
