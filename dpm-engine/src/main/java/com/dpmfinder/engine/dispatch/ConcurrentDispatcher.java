package com.dpmfinder.engine.dispatch;

import com.dpmfinder.common.model.FailureKind;
import com.dpmfinder.common.model.FailureRecord;
import com.dpmfinder.common.model.MetricOutcome;
import com.dpmfinder.common.model.MetricRateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Fans a list of metric names out over a bounded number of concurrent workers and
 * collects one {@link MetricOutcome} per name.
 *
 * <p>The name list is the work queue: {@code flatMap} with a concurrency of
 * {@code workers} keeps at most that many evaluations in flight and pulls the next
 * name as soon as one finishes, so a slow metric never holds up the others. Each
 * evaluation is subscribed on {@link Schedulers#boundedElastic()}, which also keeps
 * blocking workers off the caller's thread.
 *
 * <p>Failure isolation: an error, an empty completion or a thrown exception from the
 * worker becomes a {@link FailureRecord} for that name only. The returned
 * {@code Mono} completes after every name has produced its outcome; there is no
 * early exit.
 */
public class ConcurrentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentDispatcher.class);

    private final Scheduler scheduler;

    public ConcurrentDispatcher() {
        this(Schedulers.boundedElastic());
    }

    public ConcurrentDispatcher(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Mono<DispatchResult> run(List<String> names,
                                    Function<String, Mono<MetricOutcome>> worker,
                                    int concurrency) {
        int workers = Math.max(1, concurrency);
        log.info("DISPATCH_START metrics={} workers={}", names.size(), workers);

        return Flux.fromIterable(names)
            .distinct()
            .flatMap(name -> evaluate(name, worker), workers)
            .collectList()
            .map(outcomes -> collect(outcomes, workers));
    }

    private Mono<MetricOutcome> evaluate(String name, Function<String, Mono<MetricOutcome>> worker) {
        return Mono.defer(() -> {
                long start = System.nanoTime();
                return Mono.defer(() -> worker.apply(name))
                    .switchIfEmpty(Mono.fromSupplier(() -> MetricOutcome.failure(new FailureRecord(
                        name, FailureKind.MALFORMED_RESPONSE, 1, "worker produced no outcome"))))
                    .onErrorResume(e -> {
                        log.warn("WORKER_ERROR metric={} error={}", name, e.toString());
                        return Mono.just(MetricOutcome.failure(new FailureRecord(
                            name, FailureKind.NETWORK_ERROR, 1, String.valueOf(e.getMessage()))));
                    })
                    .map(outcome -> outcome.withElapsed(Duration.ofNanos(System.nanoTime() - start)));
            })
            .subscribeOn(scheduler);
    }

    private static DispatchResult collect(List<MetricOutcome> outcomes, int workers) {
        List<MetricRateResult> results = new ArrayList<>();
        List<FailureRecord> failures = new ArrayList<>();
        Duration cumulative = Duration.ZERO;
        for (MetricOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                results.add(outcome.result());
            } else {
                failures.add(outcome.failure());
            }
            cumulative = cumulative.plus(outcome.elapsed());
        }
        log.info("DISPATCH_DONE succeeded={} failed={}", results.size(), failures.size());
        return new DispatchResult(results, failures, cumulative, workers);
    }
}
