package com.dpmfinder.exporter.health;

import com.dpmfinder.exporter.refresh.RefreshCoordinator;
import com.dpmfinder.exporter.refresh.RefreshStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports OUT_OF_SERVICE until a first snapshot exists. Part of the readiness group
 * only; a failing refresh never makes the process look dead.
 */
@Component("snapshot")
public class SnapshotHealthIndicator implements HealthIndicator {

    private final RefreshCoordinator coordinator;

    public SnapshotHealthIndicator(RefreshCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        RefreshStatus status = coordinator.status();
        Health.Builder builder = coordinator.currentReport().isPresent() ? Health.up() : Health.outOfService();
        builder.withDetail("state", status.state())
               .withDetail("cyclesCompleted", status.cyclesCompleted())
               .withDetail("consecutiveFailures", status.consecutiveFailures());
        if (status.lastSuccessAt() != null) {
            builder.withDetail("lastSuccessAt", status.lastSuccessAt().toString());
        }
        if (status.lastFailureMessage() != null) {
            builder.withDetail("lastFailure", status.lastFailureMessage());
        }
        return builder.build();
    }
}
