package com.dpmfinder.common.selection;

import java.util.Locale;

public enum SortKey {
    /** DPM descending, ties broken by metric name ascending. */
    DPM,
    /** Metric name ascending. */
    NAME;

    public static SortKey parse(String raw) {
        if (raw == null || raw.isBlank()) return DPM;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sort key '" + raw + "', expected 'dpm' or 'name'", e);
        }
    }
}
