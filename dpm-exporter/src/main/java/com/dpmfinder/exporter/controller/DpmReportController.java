package com.dpmfinder.exporter.controller;

import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.exporter.refresh.RefreshCoordinator;
import com.dpmfinder.exporter.refresh.RefreshStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/dpm")
public class DpmReportController {

    private final RefreshCoordinator coordinator;

    public DpmReportController(RefreshCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Latest complete report. 503 until the first cycle has finished; afterwards
     * always the last successful snapshot, even while a new cycle is running.
     */
    @GetMapping("/report")
    public Mono<ResponseEntity<CycleReport>> report() {
        return Mono.justOrEmpty(coordinator.currentReport())
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
    }

    @GetMapping("/status")
    public Mono<RefreshStatus> status() {
        return Mono.just(coordinator.status());
    }

    /** Starts a cycle now. 409 if one is already running. */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<Map<String, Object>>> refresh() {
        boolean started = coordinator.triggerRefresh("manual");
        HttpStatus status = started ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return Mono.just(ResponseEntity.status(status)
            .body(Map.of("started", started, "state", coordinator.state().name())));
    }
}
