package com.dpmfinder.engine.cycle;

import com.dpmfinder.common.exception.CycleAbortedException;
import com.dpmfinder.common.filter.MetricFilter;
import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.CycleStatistics;
import com.dpmfinder.common.model.MetricRateResult;
import com.dpmfinder.common.selection.ResultSelector;
import com.dpmfinder.engine.client.PrometheusQueryClient;
import com.dpmfinder.engine.dispatch.ConcurrentDispatcher;
import com.dpmfinder.engine.dispatch.DispatchResult;
import com.dpmfinder.engine.rate.RateCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * One discovery → filter → compute → select pass, shared by the one-shot CLI and
 * the exporter's refresh loop.
 *
 * <pre>
 *   names ─┐
 *          ├─ MetricFilter ─ ConcurrentDispatcher(RateCalculator) ─ ResultSelector ─ CycleReport
 *   rules ─┘
 * </pre>
 *
 * <p>If either discovery call fails the cycle fails with {@link CycleAbortedException};
 * per-metric failures only end up in {@link CycleReport#failures()}.
 */
public class CycleRunner {

    private static final Logger log = LoggerFactory.getLogger(CycleRunner.class);

    private final PrometheusQueryClient client;
    private final MetricFilter filter;
    private final RateCalculator calculator;
    private final ConcurrentDispatcher dispatcher;
    private final CycleOptions options;
    private final Clock clock;

    public CycleRunner(PrometheusQueryClient client, MetricFilter filter, RateCalculator calculator,
                       ConcurrentDispatcher dispatcher, CycleOptions options, Clock clock) {
        this.client     = client;
        this.filter     = filter;
        this.calculator = calculator;
        this.dispatcher = dispatcher;
        this.options    = options;
        this.clock      = clock;
    }

    public Mono<CycleReport> runCycle() {
        return Mono.defer(() -> {
            Instant startedAt = clock.instant();
            long startNanos = System.nanoTime();

            return Mono.zip(client.listMetricNames(), client.listAggregationRuleNames())
                .onErrorMap(e -> !(e instanceof CycleAbortedException),
                    e -> new CycleAbortedException("Metric discovery failed: " + e.getMessage(), e))
                .flatMap(discovery -> {
                    List<String> universe = discovery.getT1();
                    Set<String> rules = discovery.getT2();
                    MetricFilter.Selection selection = filter.apply(universe, rules);
                    log.info("METRICS_FILTERED discovered={} kept={} excluded={}",
                             universe.size(), selection.kept().size(), selection.excludedByReason());

                    return dispatcher.run(selection.kept(),
                            name -> calculator.computeRate(name, options.rate()), options.threads())
                        .map(dispatch -> toReport(universe.size(), dispatch, startedAt,
                            Duration.ofNanos(System.nanoTime() - startNanos)));
                });
        });
    }

    public CycleOptions options() {
        return options;
    }

    private CycleReport toReport(int discovered, DispatchResult dispatch, Instant startedAt, Duration runtime) {
        List<MetricRateResult> selected = ResultSelector.select(dispatch.results(), options.selection());
        CycleStatistics stats = CycleStatistics.of(discovered, dispatch.processed(),
            dispatch.results().size(), dispatch.failures().size(), selected.size(),
            dispatch.workers(), runtime, dispatch.cumulativeMetricTime());

        log.info("CYCLE_COMPLETE discovered={} processed={} succeeded={} failed={} aboveThreshold={} "
                 + "runtimeSeconds={} avgMetricSeconds={} metricsPerSecond={} effectiveWorkers={}",
                 stats.discovered(), stats.processed(), stats.succeeded(), stats.failed(), stats.selected(),
                 String.format("%.2f", stats.totalRuntimeSeconds()),
                 String.format("%.3f", stats.averageMetricSeconds()),
                 String.format("%.1f", stats.metricsPerSecond()),
                 stats.effectiveWorkers());
        if (!dispatch.failures().isEmpty()) {
            log.warn("CYCLE_PARTIAL_FAILURE failed={} sample={}", dispatch.failures().size(),
                     dispatch.failures().stream().limit(5).map(f -> f.name() + ":" + f.kind()).toList());
        }
        return new CycleReport(selected, dispatch.failures(), startedAt, clock.instant(), stats);
    }
}
