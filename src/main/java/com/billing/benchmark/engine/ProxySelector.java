package com.billing.benchmark.engine;

import com.billing.benchmark.model.ProxyMethod;
import com.billing.benchmark.model.ValueFrequency;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the representative value of a group from its cent-rounded candidates.
 *
 * <ul>
 *   <li>Thin groups (size at or below the threshold): the maximum.</li>
 *   <li>Otherwise the most frequent value; equal frequencies resolve to the higher amount.</li>
 * </ul>
 */
public final class ProxySelector {

    static final Comparator<ValueFrequency> RANKING = Comparator
            .comparingInt(ValueFrequency::count).reversed()
            .thenComparing(Comparator.comparingDouble(ValueFrequency::value).reversed());

    private ProxySelector() {}

    public static ProxySelection select(List<Double> candidates, int thinGroupMaxSize) {
        List<Double> values = candidates.stream().map(Amounts::round2).toList();

        if (values.size() <= thinGroupMaxSize) {
            double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            return new ProxySelection(max, ProxyMethod.MAX_WHEN_FEW);
        }

        List<ValueFrequency> ranked = rankFrequencies(values);
        ValueFrequency top = ranked.get(0);
        boolean clearWinner = ranked.size() == 1 || top.count() > ranked.get(1).count();
        return new ProxySelection(top.value(), clearWinner ? ProxyMethod.MODE : ProxyMethod.MODE_TIE_MAX);
    }

    /**
     * Cent-rounded values with their counts, most frequent first, higher amount first on equal counts.
     */
    public static List<ValueFrequency> rankFrequencies(Collection<Double> values) {
        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (Double value : values) {
            counts.merge(Amounts.round2(value), 1, Integer::sum);
        }
        List<ValueFrequency> ranked = new ArrayList<>(counts.size());
        counts.forEach((value, count) -> ranked.add(new ValueFrequency(value, count)));
        ranked.sort(RANKING);
        return ranked;
    }
}
