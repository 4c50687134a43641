package com.billing.benchmark.engine;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupKey;
import com.billing.benchmark.model.ProxyMethod;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Resolves a group's proxy: decontaminates allowed-benchmark candidates, selects
 * max or mode, then lets a manual override win.
 */
@Component
public class ProxyResolver {

    public ProxyResolution resolve(GroupKey key, List<CanonicalLine> lines,
                                   AnalysisSettings settings, Map<String, Double> overrides) {
        int equalChargesCount = (int) lines.stream().filter(settings::allowedEqualsCharges).count();
        boolean decontaminate = settings.benchmark() == BenchmarkMetric.ALLOWED
                && settings.decontaminateChargesProxy();

        List<Double> candidates = candidates(lines, settings, decontaminate && equalChargesCount > 0);
        ProxySelection selection = ProxySelector.select(candidates, settings.thinGroupMaxSize());

        Double override = overrides.get(key.label());
        if (override != null && Double.isFinite(override)) {
            return new ProxyResolution(Amounts.round2(override), ProxyMethod.OVERRIDE,
                    equalChargesCount, decontaminate && equalChargesCount > 0);
        }
        return new ProxyResolution(selection.value(), selection.method(),
                equalChargesCount, decontaminate && equalChargesCount > 0);
    }

    private List<Double> candidates(List<CanonicalLine> lines, AnalysisSettings settings, boolean filter) {
        List<Double> all = lines.stream().map(settings::metricOf).toList();
        if (!filter) {
            return all;
        }
        // Only lines billed at something other than charges, unless none are
        List<Double> clean = lines.stream()
                .filter(line -> !settings.allowedEqualsCharges(line))
                .map(settings::metricOf)
                .toList();
        return clean.isEmpty() ? all : clean;
    }
}
