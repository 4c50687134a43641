package com.billing.benchmark.service;

import com.billing.benchmark.engine.GroupKeyBuilder;
import com.billing.benchmark.model.AnalysisResult;
import com.billing.benchmark.model.GroupDescriptor;
import com.billing.benchmark.model.GroupKey;
import com.billing.benchmark.model.GroupLookupResult;
import com.billing.benchmark.model.GroupStat;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Explains where a proxy came from for hand-entered group descriptors, typically
 * taken from an older report whose numbers no longer match.
 */
@Service
public class GroupLookupService {

    static final String NOT_FOUND = "No matching group in loaded data (payer/CPT/POS/mods/units). "
            + "The old proxy likely came from a different grouping or time period.";
    static final String MULTI_MODAL = "⚠ multi‑modal distribution (tie)";
    static final String NEAR_TIE = "⚠ near tie in distribution";
    static final String DECONTAMINATED = "Group had mixed lines (Allowed==Charges and others). "
            + "We ignored equals‑charges lines when benchmarking Allowed.";

    private final AnalysisService analysisService;
    private final GroupKeyBuilder keyBuilder;

    public GroupLookupService(AnalysisService analysisService, GroupKeyBuilder keyBuilder) {
        this.analysisService = analysisService;
        this.keyBuilder = keyBuilder;
    }

    public List<GroupLookupResult> lookup(List<GroupDescriptor> descriptors) {
        AnalysisResult result = analysisService.getLastResult();
        return descriptors.stream().map(d -> lookup(d, result)).toList();
    }

    GroupLookupResult lookup(GroupDescriptor descriptor, AnalysisResult result) {
        boolean includeUnits = result.getSettings().includeUnitsInKey();
        GroupKey key = keyBuilder.keyFor(descriptor, includeUnits);
        // Always report units, even when they are not part of the key
        GroupKey withUnits = keyBuilder.keyFor(descriptor, true);

        GroupLookupResult.GroupLookupResultBuilder builder = GroupLookupResult.builder()
                .payer(key.payer())
                .procedureCode(key.procedureCode())
                .placeOfService(key.placeOfService())
                .modifiers(key.modifiers())
                .units(withUnits.units())
                .key(key.label());

        Optional<GroupStat> match = result.findGroup(key);
        if (match.isEmpty()) {
            return builder.found(false).message(NOT_FOUND).build();
        }

        GroupStat stat = match.get();
        return builder
                .found(true)
                .proxy(stat.getProxy())
                .method(stat.getMethodLabel())
                .n(stat.getN())
                .equalChargesCount(stat.getEqualChargesCount())
                .range(String.format(Locale.US, "%.2f – %.2f", stat.getMin(), stat.getMax()))
                .topValues(stat.getTopValueFrequencies().stream()
                        .limit(result.getSettings().topValuesLimit())
                        .toList())
                .message(message(stat))
                .build();
    }

    private static String message(GroupStat stat) {
        if (stat.isMultiModal()) return MULTI_MODAL;
        if (stat.isNearTie()) return NEAR_TIE;
        if (stat.isUsedDecontaminate()) return DECONTAMINATED;
        return "";
    }
}
