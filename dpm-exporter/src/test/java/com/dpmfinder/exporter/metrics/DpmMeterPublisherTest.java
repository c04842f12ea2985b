package com.dpmfinder.exporter.metrics;

import com.dpmfinder.common.model.MetricRateResult;
import com.dpmfinder.common.selection.SelectionCriteria;
import com.dpmfinder.engine.cycle.CycleOptions;
import com.dpmfinder.engine.rate.RateOptions;
import com.dpmfinder.exporter.Reports;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dpmfinder.common.exposition.ExpositionNames.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DpmMeterPublisherTest {

    private SimpleMeterRegistry registry;
    private DpmMeterPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        CycleOptions options = new CycleOptions(RateOptions.defaults(), SelectionCriteria.threshold(1.0), 10);
        publisher = new DpmMeterPublisher(registry, options, 86400, "1.0.0");
    }

    private double dpmOf(String label) {
        return registry.get(DPM_RATE).tag(METRIC_NAME_LABEL, label).gauge().value();
    }

    @Test
    @DisplayName("run gauges read zero before the first snapshot")
    void zeroBeforeFirstSnapshot() {
        assertThat(registry.find(DPM_RATE).gauges()).isEmpty();
        assertThat(registry.get(RUNTIME_SECONDS).gauge().value()).isZero();
        assertThat(registry.get(LAST_UPDATE).gauge().value()).isZero();
    }

    @Test
    @DisplayName("publishes one dpm gauge per result with sanitized metric names")
    void perMetricGauges() {
        publisher.onSnapshot(Reports.of(
            MetricRateResult.of("http_requests_total", 120),
            MetricRateResult.of("app.cache:hits-total", 4)));

        assertThat(dpmOf("http_requests_total")).isEqualTo(120.0);
        assertThat(dpmOf("app_cache_hits_total")).isEqualTo(4.0);
        assertThat(registry.find(ACTIVE_SERIES).gauges()).isEmpty();
    }

    @Test
    @DisplayName("publishes series and impact gauges only for enriched results")
    void seriesAndImpact() {
        publisher.onSnapshot(Reports.of(
            MetricRateResult.of("a", 10).withActiveSeries(3),
            MetricRateResult.of("b", 2)));

        assertThat(registry.get(ACTIVE_SERIES).tag(METRIC_NAME_LABEL, "a").gauge().value()).isEqualTo(3.0);
        assertThat(registry.get(IMPACT_SCORE).tag(METRIC_NAME_LABEL, "a").gauge().value()).isEqualTo(30.0);
        assertThat(registry.find(IMPACT_SCORE).tag(METRIC_NAME_LABEL, "b").gauge()).isNull();
    }

    @Test
    @DisplayName("metrics missing from the next snapshot are removed")
    void staleRowsRemoved() {
        publisher.onSnapshot(Reports.of(MetricRateResult.of("a", 10), MetricRateResult.of("b", 5)));
        publisher.onSnapshot(Reports.of(MetricRateResult.of("a", 12)));

        assertThat(dpmOf("a")).isEqualTo(12.0);
        assertThat(registry.find(DPM_RATE).tag(METRIC_NAME_LABEL, "b").gauge()).isNull();
    }

    @Test
    @DisplayName("keeps the first result when two names sanitize to the same label")
    void sanitizedCollision() {
        publisher.onSnapshot(Reports.of(MetricRateResult.of("a.b", 50), MetricRateResult.of("a_b", 7)));

        assertThat(registry.find(DPM_RATE).gauges()).hasSize(1);
        assertThat(dpmOf("a_b")).isEqualTo(50.0);
    }

    @Test
    @DisplayName("run statistics follow the latest snapshot and processed count accumulates")
    void runStatistics() {
        publisher.onSnapshot(Reports.withFailures(
            List.of(MetricRateResult.of("a", 10)), List.of(Reports.timeout("slow"))));
        publisher.onSnapshot(Reports.of(MetricRateResult.of("a", 10)));

        assertThat(registry.get(RUNTIME_SECONDS).gauge().value()).isEqualTo(2.0);
        assertThat(registry.get(AVG_METRIC_SECONDS).gauge().value()).isEqualTo(0.5);
        assertThat(registry.get(METRICS_FAILED).gauge().value()).isZero();
        assertThat(registry.get(PROCESSING_RATE).gauge().value()).isCloseTo(0.5, within(1e-9));
        assertThat(registry.get(METRICS_PROCESSED).functionCounter().count()).isEqualTo(3.0);
        assertThat(registry.get(LAST_UPDATE).gauge().value())
            .isEqualTo(Reports.FINISHED_AT.getEpochSecond());
    }

    @Test
    @DisplayName("exposes configuration on the info gauge")
    void infoGauge() {
        Gauge info = registry.get(EXPORTER_INFO).gauge();

        assertThat(info.value()).isEqualTo(1.0);
        assertThat(info.getId().getTag("version")).isEqualTo("1.0.0");
        assertThat(info.getId().getTag("min_dpm_threshold")).isEqualTo("1.0");
        assertThat(info.getId().getTag("update_interval_seconds")).isEqualTo("86400");
        assertThat(info.getId().getTag("thread_count")).isEqualTo("10");
    }
}
