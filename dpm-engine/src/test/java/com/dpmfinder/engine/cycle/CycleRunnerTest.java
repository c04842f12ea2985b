package com.dpmfinder.engine.cycle;

import com.dpmfinder.common.exception.CycleAbortedException;
import com.dpmfinder.common.filter.MetricFilter;
import com.dpmfinder.common.model.CycleReport;
import com.dpmfinder.common.model.FailureKind;
import com.dpmfinder.common.model.MetricRateResult;
import com.dpmfinder.common.selection.LabelMatcher;
import com.dpmfinder.common.selection.SelectionCriteria;
import com.dpmfinder.common.selection.SortKey;
import com.dpmfinder.engine.client.PrometheusQueryClient;
import com.dpmfinder.engine.client.StubBackend;
import com.dpmfinder.engine.dispatch.ConcurrentDispatcher;
import com.dpmfinder.engine.rate.RateCalculator;
import com.dpmfinder.engine.rate.RateOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CycleRunnerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private static final String NAMES = "{\"status\":\"success\",\"data\":["
        + "\"http_requests_total\",\"http_requests_count\",\"grafana_build_info\",\"custom_metric\","
        + "\"rolled_up\",\"m\",\"quiet_metric\"]}";
    private static final String RULES = "[{\"metric\":\"rolled_up\"}]";

    private static final Map<String, String> DPM = Map.of(
        "http_requests_total", "120",
        "custom_metric", "4",
        "quiet_metric", "1");

    private static Mono<ClientResponse> answer(String path) {
        if (path.endsWith("/label/__name__/values")) return StubBackend.json(NAMES);
        if (path.endsWith("/aggregations/rules")) return StubBackend.json(RULES);
        if (path.contains("count_over_time(m[")) return Mono.never();
        for (Map.Entry<String, String> e : DPM.entrySet()) {
            if (path.contains("count_over_time(" + e.getKey() + "[")) {
                return StubBackend.json(StubBackend.vector(e.getKey(), e.getValue()));
            }
        }
        return StubBackend.json(StubBackend.emptyVector());
    }

    private static CycleRunner runner(StubBackend backend, SelectionCriteria selection, int threads) {
        PrometheusQueryClient client = backend.client(3, Duration.ofMillis(100));
        return new CycleRunner(client, MetricFilter.defaults(), new RateCalculator(client),
            new ConcurrentDispatcher(),
            new CycleOptions(new RateOptions(5, false, false, false), selection, threads),
            CLOCK);
    }

    @Nested
    @DisplayName("full cycle")
    class FullCycle {

        @Test
        @DisplayName("filters, computes, isolates the hung metric and selects above threshold")
        void endToEnd() {
            StubBackend backend = new StubBackend(CycleRunnerTest::answer);

            CycleReport report = runner(backend, SelectionCriteria.threshold(1.0), 4).runCycle()
                .block(Duration.ofSeconds(10));

            assertThat(report.results()).extracting(MetricRateResult::name)
                .containsExactly("http_requests_total", "custom_metric");
            assertThat(report.failures()).singleElement().satisfies(f -> {
                assertThat(f.name()).isEqualTo("m");
                assertThat(f.kind()).isEqualTo(FailureKind.TIMEOUT);
                assertThat(f.attempts()).isEqualTo(3);
            });
            assertThat(report.statistics().discovered()).isEqualTo(7);
            assertThat(report.statistics().filteredOut()).isEqualTo(3);
            assertThat(report.statistics().processed()).isEqualTo(4);
            assertThat(report.statistics().succeeded()).isEqualTo(3);
            assertThat(report.statistics().failed()).isEqualTo(1);
            assertThat(report.statistics().selected()).isEqualTo(2);
            assertThat(report.startedAt()).isEqualTo(CLOCK.instant());
            assertThat(backend.requests).noneMatch(p -> p.contains("grafana_build_info")
                || p.contains("http_requests_count") || p.contains("rolled_up"));
        }

        @Test
        @DisplayName("same backend state gives the same selection at any worker count")
        void independentOfWorkerCount() {
            SelectionCriteria criteria = new SelectionCriteria(0.0, null, 0, SortKey.NAME);
            List<MetricRateResult> single = runner(new StubBackend(CycleRunnerTest::answer), criteria, 1)
                .runCycle().block(Duration.ofSeconds(10)).results();
            List<MetricRateResult> many = runner(new StubBackend(CycleRunnerTest::answer), criteria, 16)
                .runCycle().block(Duration.ofSeconds(10)).results();

            assertThat(many).isEqualTo(single);
        }
    }

    @Nested
    @DisplayName("cycle-level failures")
    class Aborts {

        @Test
        @DisplayName("discovery failure aborts the cycle")
        void discoveryFails() {
            StubBackend backend = new StubBackend(path -> path.endsWith("/values")
                ? StubBackend.status(HttpStatus.FORBIDDEN)
                : answer(path));

            StepVerifier.create(runner(backend, SelectionCriteria.threshold(1.0), 2).runCycle())
                .expectError(CycleAbortedException.class)
                .verify(Duration.ofSeconds(10));
        }

        @Test
        @DisplayName("rules listing failure aborts the cycle")
        void rulesFail() {
            StubBackend backend = new StubBackend(path -> path.endsWith("/rules")
                ? StubBackend.json("{\"unexpected\":true}")
                : answer(path));

            StepVerifier.create(runner(backend, SelectionCriteria.threshold(1.0), 2).runCycle())
                .expectError(CycleAbortedException.class)
                .verify(Duration.ofSeconds(10));
        }
    }

    @Test
    @DisplayName("a label filter without label enrichment is rejected")
    void labelFilterRequiresEnrichment() {
        SelectionCriteria criteria = new SelectionCriteria(1.0, LabelMatcher.parse("job=api"), 0, SortKey.DPM);

        assertThatThrownBy(() -> new CycleOptions(RateOptions.defaults(), criteria, 4))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("dpm.rate.labels");
        assertThat(new CycleOptions(new RateOptions(5, false, true, true), criteria, 0).threads()).isEqualTo(1);
    }
}
