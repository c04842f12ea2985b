package com.dpmfinder.common.filter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which discovered metrics are worth a rate query.
 *
 * <p>Rules, evaluated in order (any match excludes):
 * <ol>
 *   <li>name ends with a histogram/summary suffix ({@code _count}, {@code _bucket}, {@code _sum} by default)</li>
 *   <li>name starts with an internal-metrics prefix ({@code grafana_} by default)</li>
 *   <li>name is produced by a backend aggregation rule</li>
 * </ol>
 *
 * <p>Pure: no I/O, no state beyond the configured suffix and prefix lists.
 */
public final class MetricFilter {

    public static final List<String> DEFAULT_SUFFIXES = List.of("_count", "_bucket", "_sum");
    public static final List<String> DEFAULT_PREFIXES = List.of("grafana_");

    private final List<String> excludedSuffixes;
    private final List<String> excludedPrefixes;

    public MetricFilter(List<String> excludedSuffixes, List<String> excludedPrefixes) {
        this.excludedSuffixes = clean(excludedSuffixes);
        this.excludedPrefixes = clean(excludedPrefixes);
    }

    public static MetricFilter defaults() {
        return new MetricFilter(DEFAULT_SUFFIXES, DEFAULT_PREFIXES);
    }

    public boolean shouldExclude(String name, Set<String> aggregationRuleNames) {
        return exclusionReason(name, aggregationRuleNames).isPresent();
    }

    public Optional<ExclusionReason> exclusionReason(String name, Set<String> aggregationRuleNames) {
        for (String suffix : excludedSuffixes) {
            if (name.endsWith(suffix)) return Optional.of(ExclusionReason.HISTOGRAM_SUFFIX);
        }
        for (String prefix : excludedPrefixes) {
            if (name.startsWith(prefix)) return Optional.of(ExclusionReason.INTERNAL_PREFIX);
        }
        if (aggregationRuleNames != null && aggregationRuleNames.contains(name)) {
            return Optional.of(ExclusionReason.AGGREGATION_RULE);
        }
        return Optional.empty();
    }

    /**
     * Applies the filter to a whole metric universe. Discovery order is kept and
     * repeated names collapse into one entry.
     */
    public Selection apply(List<String> universe, Set<String> aggregationRuleNames) {
        Set<String> kept = new LinkedHashSet<>();
        Map<ExclusionReason, Integer> excluded = new EnumMap<>(ExclusionReason.class);
        for (String name : new LinkedHashSet<>(universe)) {
            Optional<ExclusionReason> reason = exclusionReason(name, aggregationRuleNames);
            if (reason.isPresent()) {
                excluded.merge(reason.get(), 1, Integer::sum);
            } else {
                kept.add(name);
            }
        }
        return new Selection(List.copyOf(kept), Map.copyOf(excluded));
    }

    public List<String> excludedSuffixes() { return excludedSuffixes; }
    public List<String> excludedPrefixes() { return excludedPrefixes; }

    private static List<String> clean(List<String> values) {
        if (values == null) return List.of();
        List<String> out = new ArrayList<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return List.copyOf(out);
    }

    /** Names that survived the filter, plus how many were dropped by each rule. */
    public record Selection(List<String> kept, Map<ExclusionReason, Integer> excludedByReason) {

        public int excludedCount() {
            return excludedByReason.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
