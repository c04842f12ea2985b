package com.dpmfinder.exporter.metrics;

import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.CycleStatistics;
import com.dpmfinder.common.model.MetricRateResult;
import com.dpmfinder.engine.cycle.CycleOptions;
import com.dpmfinder.exporter.refresh.SnapshotListener;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToDoubleFunction;

import static com.dpmfinder.common.exposition.ExpositionNames.*;

/**
 * Mirrors each published {@link CycleReport} into the Micrometer registry scraped at
 * {@code /metrics}.
 *
 * <p>Per-metric gauges are re-registered as a whole on every snapshot
 * ({@link MultiGauge#register(Iterable, boolean)} with overwrite), so a metric that
 * drops below the threshold disappears from the exposition at the next refresh.
 */
@Component
public class DpmMeterPublisher implements SnapshotListener {

    private static final Logger log = LoggerFactory.getLogger(DpmMeterPublisher.class);

    private final MultiGauge dpmRate;
    private final MultiGauge activeSeries;
    private final MultiGauge impactScore;

    private final AtomicReference<CycleReport> latest = new AtomicReference<>();
    private final AtomicLong processedTotal = new AtomicLong();

    public DpmMeterPublisher(MeterRegistry registry,
                             CycleOptions cycleOptions,
                             @Value("${dpm.refresh.interval-seconds:86400}") long intervalSeconds,
                             @Value("${dpm.exporter.version:1.0.0}") String version) {
        this.dpmRate = MultiGauge.builder(DPM_RATE)
            .description("Data points per minute for each metric")
            .register(registry);
        this.activeSeries = MultiGauge.builder(ACTIVE_SERIES)
            .description("Number of active time series for each metric")
            .register(registry);
        this.impactScore = MultiGauge.builder(IMPACT_SCORE)
            .description("DPM multiplied by active series count")
            .register(registry);

        statisticGauge(registry, RUNTIME_SECONDS, "Duration of the last refresh cycle",
            CycleStatistics::totalRuntimeSeconds);
        statisticGauge(registry, AVG_METRIC_SECONDS, "Average time spent per metric in the last cycle",
            CycleStatistics::averageMetricSeconds);
        statisticGauge(registry, METRICS_FAILED, "Metrics that could not be evaluated in the last cycle",
            CycleStatistics::failed);
        statisticGauge(registry, PROCESSING_RATE, "Metrics evaluated per second in the last cycle",
            CycleStatistics::metricsPerSecond);

        FunctionCounter.builder(METRICS_PROCESSED, processedTotal, AtomicLong::get)
            .description("Metrics evaluated across all refresh cycles")
            .register(registry);

        Gauge.builder(LAST_UPDATE, latest,
                ref -> ref.get() == null ? 0.0 : ref.get().finishedAt().toEpochMilli() / 1000.0)
            .description("Unix time of the last successful refresh")
            .register(registry);

        Gauge.builder(EXPORTER_INFO, () -> 1)
            .description("DPM finder exporter configuration")
            .tags("version", version,
                  "min_dpm_threshold", String.valueOf(cycleOptions.selection().minDpm()),
                  "update_interval_seconds", String.valueOf(intervalSeconds),
                  "thread_count", String.valueOf(cycleOptions.threads()))
            .register(registry);
    }

    @Override
    public void onSnapshot(CycleReport report) {
        Map<String, MetricRateResult> bySanitizedName = new LinkedHashMap<>();
        for (MetricRateResult result : report.results()) {
            // results are ordered, so the first of two colliding names is the one kept
            bySanitizedName.putIfAbsent(sanitize(result.name()), result);
        }

        List<MultiGauge.Row<?>> dpmRows = new ArrayList<>();
        List<MultiGauge.Row<?>> seriesRows = new ArrayList<>();
        List<MultiGauge.Row<?>> impactRows = new ArrayList<>();
        bySanitizedName.forEach((label, result) -> {
            Tags tags = Tags.of(METRIC_NAME_LABEL, label);
            dpmRows.add(MultiGauge.Row.of(tags, result.dpm()));
            if (result.activeSeries() != null) {
                seriesRows.add(MultiGauge.Row.of(tags, result.activeSeries()));
            }
            if (result.impactScore() != null) {
                impactRows.add(MultiGauge.Row.of(tags, result.impactScore()));
            }
        });

        dpmRate.register(dpmRows, true);
        activeSeries.register(seriesRows, true);
        impactScore.register(impactRows, true);

        latest.set(report);
        processedTotal.addAndGet(report.statistics().processed());
        log.info("METRICS_PUBLISHED series={} collisions={}",
                 dpmRows.size(), report.results().size() - bySanitizedName.size());
    }

    private void statisticGauge(MeterRegistry registry, String name, String description,
                                ToDoubleFunction<CycleStatistics> value) {
        Gauge.builder(name, latest, ref -> ref.get() == null ? 0.0 : value.applyAsDouble(ref.get().statistics()))
            .description(description)
            .register(registry);
    }
}
