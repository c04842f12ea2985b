package com.dpmfinder.exporter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.dpmfinder")
public class DpmExporterApplication {

    public static void main(String[] args) {
        SpringApplication.run(DpmExporterApplication.class, args);
    }
}
