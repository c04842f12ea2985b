package com.dpmfinder.exporter.refresh;

import java.time.Instant;

/**
 * Point-in-time view of the refresh loop, for the status endpoint and health checks.
 */
public record RefreshStatus(
    RefreshState state,
    Instant lastSuccessAt,
    Instant lastFailureAt,
    String lastFailureMessage,
    int consecutiveFailures,
    long cyclesCompleted,
    long skippedTriggers,
    long intervalSeconds
) {}
