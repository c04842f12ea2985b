package com.dpmfinder.engine.config;

import com.dpmfinder.common.filter.MetricFilter;
import com.dpmfinder.common.selection.LabelMatcher;
import com.dpmfinder.common.selection.SelectionCriteria;
import com.dpmfinder.common.selection.SortKey;
import com.dpmfinder.engine.client.PrometheusQueryClient;
import com.dpmfinder.engine.cycle.CycleOptions;
import com.dpmfinder.engine.cycle.CycleRunner;
import com.dpmfinder.engine.dispatch.ConcurrentDispatcher;
import com.dpmfinder.engine.rate.RateCalculator;
import com.dpmfinder.engine.rate.RateOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${dpm.rate.window-minutes:5}")
    private int windowMinutes;

    @Value("${dpm.rate.series-count:false}")
    private boolean seriesCount;

    @Value("${dpm.rate.labels:false}")
    private boolean labels;

    @Value("${dpm.rate.ignore-usage-selector:true}")
    private boolean ignoreUsageSelector;

    @Value("${dpm.filter.excluded-suffixes:_count,_bucket,_sum}")
    private String[] excludedSuffixes;

    @Value("${dpm.filter.excluded-prefixes:grafana_}")
    private String[] excludedPrefixes;

    @Value("${dpm.select.min-dpm:1.0}")
    private double minDpm;

    @Value("${dpm.select.label-filter:}")
    private String labelFilter;

    @Value("${dpm.select.top-n:0}")
    private int topN;

    @Value("${dpm.select.sort-by:dpm}")
    private String sortBy;

    @Value("${dpm.dispatch.threads:10}")
    private int threads;

    @Bean
    public MetricFilter metricFilter() {
        return new MetricFilter(List.of(excludedSuffixes), List.of(excludedPrefixes));
    }

    @Bean
    public CycleOptions cycleOptions() {
        if (threads < 1) {
            log.warn("Thread count {} is less than 1, setting to 1", threads);
        }
        LabelMatcher matcher = labelFilter == null || labelFilter.isBlank() ? null : LabelMatcher.parse(labelFilter);
        CycleOptions options = new CycleOptions(
            new RateOptions(windowMinutes, seriesCount, labels, ignoreUsageSelector),
            new SelectionCriteria(minDpm, matcher, topN, SortKey.parse(sortBy)),
            threads);
        log.info("CYCLE_OPTIONS minDpm={} labelFilter={} topN={} sortBy={} threads={} windowMinutes={} "
                 + "seriesCount={} labels={}",
                 minDpm, matcher, topN, options.selection().sortBy(), options.threads(), windowMinutes,
                 seriesCount, labels);
        return options;
    }

    @Bean
    public RateCalculator rateCalculator(PrometheusQueryClient prometheusQueryClient) {
        return new RateCalculator(prometheusQueryClient);
    }

    @Bean
    public ConcurrentDispatcher concurrentDispatcher() {
        return new ConcurrentDispatcher();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CycleRunner cycleRunner(PrometheusQueryClient prometheusQueryClient, MetricFilter metricFilter,
                                   RateCalculator rateCalculator, ConcurrentDispatcher concurrentDispatcher,
                                   CycleOptions cycleOptions, Clock clock) {
        return new CycleRunner(prometheusQueryClient, metricFilter, rateCalculator,
            concurrentDispatcher, cycleOptions, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
