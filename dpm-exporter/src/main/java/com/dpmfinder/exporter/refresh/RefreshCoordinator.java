package com.dpmfinder.exporter.refresh;

import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.retry.BackoffPolicy;
import com.dpmfinder.engine.cycle.CycleRunner;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs {@link CycleRunner} on a fixed interval and serves the latest complete
 * {@link CycleReport}.
 *
 * <p><strong>Snapshot:</strong> the current report lives in a single
 * {@link AtomicReference} and is only ever replaced whole. Readers get either the
 * previous report or the new one, never a mix, and never wait for a running cycle.
 *
 * <p><strong>Single flight:</strong> a cycle starts only if none is running. A timer
 * tick (or manual trigger) that arrives while a cycle is in flight is dropped, not
 * queued; the next tick after the cycle finishes starts the next one.
 *
 * <p><strong>Failures:</strong> a cycle that cannot discover metrics is retried with
 * backoff (5 attempts before the first snapshot, 3 afterwards). If it still fails the
 * previous snapshot stays published and the failure is recorded in
 * {@link #status()}.
 */
@Component
public class RefreshCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RefreshCoordinator.class);

    private final CycleRunner cycleRunner;
    private final List<SnapshotListener> listeners;
    private final Duration interval;
    private final BackoffPolicy initialCyclePolicy;
    private final BackoffPolicy cyclePolicy;
    private final Duration shutdownDrain;
    private final Clock clock;
    private final Scheduler scheduler = Schedulers.boundedElastic();

    private final AtomicReference<CycleReport> current = new AtomicReference<>();
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final AtomicLong skippedTriggers = new AtomicLong();

    private volatile CompletableFuture<Void> inFlightDone = CompletableFuture.completedFuture(null);
    private volatile Disposable inFlightCycle;
    private volatile Disposable ticker;
    private volatile boolean shuttingDown;
    private volatile Instant lastFailureAt;
    private volatile String lastFailureMessage;

    public RefreshCoordinator(
            CycleRunner cycleRunner,
            List<SnapshotListener> listeners,
            @Value("${dpm.refresh.interval-seconds:86400}")        long intervalSeconds,
            @Value("${dpm.refresh.initial-max-attempts:5}")        int initialMaxAttempts,
            @Value("${dpm.refresh.cycle-max-attempts:3}")          int cycleMaxAttempts,
            @Value("${dpm.refresh.cycle-backoff-seconds:2}")       long cycleBackoffSeconds,
            @Value("${dpm.refresh.shutdown-drain-seconds:10}")     long shutdownDrainSeconds,
            Clock clock) {
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("dpm.refresh.interval-seconds must be >= 1, got " + intervalSeconds);
        }
        this.cycleRunner        = cycleRunner;
        this.listeners          = List.copyOf(listeners);
        this.interval           = Duration.ofSeconds(intervalSeconds);
        Duration base           = Duration.ofSeconds(cycleBackoffSeconds);
        this.initialCyclePolicy = new BackoffPolicy(initialMaxAttempts, base, base.multipliedBy(16));
        this.cyclePolicy        = new BackoffPolicy(cycleMaxAttempts, base, base.multipliedBy(16));
        this.shutdownDrain      = Duration.ofSeconds(shutdownDrainSeconds);
        this.clock              = clock;
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    /** Starts the timer. The first tick fires immediately, so collection begins at startup. */
    @PostConstruct
    public void start() {
        if (interval.toSeconds() < 30) {
            log.warn("Update interval {}s is very short, consider using 30s or more", interval.toSeconds());
        }
        log.info("REFRESH_LOOP_STARTED intervalSeconds={}", interval.toSeconds());
        ticker = Flux.interval(Duration.ZERO, interval)
            .subscribe(tick -> triggerRefresh("timer"));
    }

    /**
     * Stops accepting ticks, then gives an in-flight cycle {@code shutdown-drain-seconds}
     * to finish before abandoning it.
     */
    @PreDestroy
    public void stop() {
        shuttingDown = true;
        Disposable t = ticker;
        if (t != null) t.dispose();
        if (!inFlight.get()) {
            log.info("REFRESH_LOOP_STOPPED inFlight=false");
            return;
        }
        log.info("REFRESH_LOOP_DRAINING drainSeconds={}", shutdownDrain.toSeconds());
        try {
            inFlightDone.get(shutdownDrain.toMillis(), TimeUnit.MILLISECONDS);
            log.info("REFRESH_LOOP_STOPPED inFlight=drained");
        } catch (TimeoutException e) {
            log.warn("REFRESH_LOOP_STOPPED inFlight=abandoned after {}s", shutdownDrain.toSeconds());
            abandonInFlight();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonInFlight();
        } catch (ExecutionException e) {
            log.warn("REFRESH_LOOP_STOPPED inFlight=failed", e.getCause());
        }
    }

    // ── triggers ──────────────────────────────────────────────────────────────

    /**
     * Starts a cycle in the background unless one is already running.
     *
     * @return {@code true} if a cycle was started
     */
    public boolean triggerRefresh(String trigger) {
        if (!tryAcquire(trigger)) {
            return false;
        }
        inFlightCycle = runAcquired(trigger)
            .subscribeOn(scheduler)
            .subscribe();
        return true;
    }

    /**
     * Runs one guarded cycle and completes with its report, or completes empty if a
     * cycle was already running or this one failed.
     */
    public Mono<CycleReport> refreshCycle(String trigger) {
        return Mono.defer(() -> tryAcquire(trigger) ? runAcquired(trigger) : Mono.empty());
    }

    private boolean tryAcquire(String trigger) {
        if (shuttingDown) {
            log.info("REFRESH_SKIPPED trigger={} reason=shutting-down", trigger);
            return false;
        }
        if (!inFlight.compareAndSet(false, true)) {
            skippedTriggers.incrementAndGet();
            log.info("REFRESH_SKIPPED trigger={} reason=cycle-in-flight", trigger);
            return false;
        }
        inFlightDone = new CompletableFuture<>();
        return true;
    }

    private Mono<CycleReport> runAcquired(String trigger) {
        CompletableFuture<Void> done = inFlightDone;
        BackoffPolicy policy = current.get() == null ? initialCyclePolicy : cyclePolicy;
        log.info("REFRESH_START trigger={} hasSnapshot={} maxAttempts={}",
                 trigger, current.get() != null, policy.maxAttempts());

        return cycleRunner.runCycle()
            .retryWhen(policy.retrySpec("refresh-cycle", e -> !shuttingDown, (e, attempts) -> e))
            .doOnNext(this::publish)
            .onErrorResume(e -> {
                recordFailure(e);
                return Mono.empty();
            })
            .doFinally(signal -> {
                inFlight.set(false);
                done.complete(null);
            });
    }

    // ── snapshot ──────────────────────────────────────────────────────────────

    private void publish(CycleReport report) {
        current.set(report);
        cyclesCompleted.incrementAndGet();
        consecutiveFailures.set(0);
        log.info("SNAPSHOT_PUBLISHED results={} failed={} finishedAt={}",
                 report.results().size(), report.failures().size(), report.finishedAt());
        for (SnapshotListener listener : listeners) {
            try {
                listener.onSnapshot(report);
            } catch (RuntimeException e) {
                log.error("SNAPSHOT_LISTENER_FAILED listener={}", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void recordFailure(Throwable e) {
        lastFailureAt = clock.instant();
        lastFailureMessage = String.valueOf(e.getMessage());
        int failures = consecutiveFailures.incrementAndGet();
        log.error("REFRESH_FAILED consecutiveFailures={} keepingSnapshot={} reason={}",
                  failures, current.get() != null, lastFailureMessage, e);
    }

    private void abandonInFlight() {
        Disposable cycle = inFlightCycle;
        if (cycle != null) cycle.dispose();
        inFlight.set(false);
    }

    // ── readers ───────────────────────────────────────────────────────────────

    /** The latest complete report, or empty until the first cycle has completed. */
    public Optional<CycleReport> currentReport() {
        return Optional.ofNullable(current.get());
    }

    public RefreshState state() {
        if (inFlight.get()) return RefreshState.REFRESHING;
        return current.get() == null ? RefreshState.UNINITIALIZED : RefreshState.READY;
    }

    public RefreshStatus status() {
        CycleReport report = current.get();
        return new RefreshStatus(state(),
            report == null ? null : report.finishedAt(),
            lastFailureAt, lastFailureMessage,
            consecutiveFailures.get(), cyclesCompleted.get(), skippedTriggers.get(),
            interval.toSeconds());
    }
}
