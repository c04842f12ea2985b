package com.dpmfinder.cli.writer;

import java.util.Locale;

public enum OutputFormat {

    CSV("csv"),
    TEXT("txt"),
    JSON("json"),
    PROM("prom");

    private static final String BASE_NAME = "metric_rates";

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public String fileName() {
        return BASE_NAME + "." + extension;
    }

    /** Accepts {@code csv}, {@code text}, {@code txt}, {@code json} and {@code prom}, case-insensitively. */
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return CSV;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.equals("text")) {
            return TEXT;
        }
        for (OutputFormat format : values()) {
            if (format.extension.equals(v)) {
                return format;
            }
        }
        throw new IllegalArgumentException(
            "Unknown output format '" + value + "', expected one of csv, text, txt, json, prom");
    }
}
