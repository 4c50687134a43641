package com.billing.benchmark.engine;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupKey;
import com.billing.benchmark.model.GroupStat;
import com.billing.benchmark.model.ValueFrequency;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets lines by group key and computes distribution statistics over the
 * benchmarked amounts. The proxy itself is filled in by {@link ProxyResolver}.
 */
@Component
public class GroupAggregator {

    private final GroupKeyBuilder keyBuilder;

    public GroupAggregator(GroupKeyBuilder keyBuilder) {
        this.keyBuilder = keyBuilder;
    }

    /**
     * Groups in first-seen order, lines in arrival order within each group.
     */
    public Map<GroupKey, List<CanonicalLine>> bucket(List<CanonicalLine> lines, AnalysisSettings settings) {
        Map<GroupKey, List<CanonicalLine>> buckets = new LinkedHashMap<>();
        for (CanonicalLine line : lines) {
            GroupKey key = keyBuilder.keyFor(line, settings.includeUnitsInKey());
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(line);
        }
        return buckets;
    }

    public GroupStat describe(GroupKey key, List<CanonicalLine> lines, AnalysisSettings settings) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        List<Double> values = new ArrayList<>(lines.size());
        for (CanonicalLine line : lines) {
            double metric = settings.metricOf(line);
            stats.addValue(metric);
            values.add(metric);
        }

        List<ValueFrequency> ranked = ProxySelector.rankFrequencies(values);
        boolean multiModal = ranked.size() >= 2 && ranked.get(0).count() == ranked.get(1).count();
        boolean nearTie = ranked.size() >= 2
                && (double) ranked.get(1).count() / ranked.get(0).count() >= settings.nearTieRatio();

        return GroupStat.builder()
                .groupKey(key)
                .key(key.label())
                .payer(key.payer())
                .procedureCode(key.procedureCode())
                .placeOfService(key.placeOfService())
                .modifiers(key.modifiers())
                .units(lines.get(0).units())
                .n(lines.size())
                .median(Amounts.round2(stats.getPercentile(50)))
                .mean(Amounts.round2(stats.getMean()))
                .min(Amounts.round2(stats.getMin()))
                .max(Amounts.round2(stats.getMax()))
                .topValueFrequencies(ranked)
                .multiModal(multiModal)
                .nearTie(nearTie)
                .build();
    }
}
