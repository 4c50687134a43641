package com.billing.benchmark.engine;

import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupDescriptor;
import com.billing.benchmark.model.GroupKey;
import org.springframework.stereotype.Component;

/**
 * Builds group identities in the units-including or units-excluding variant.
 */
@Component
public class GroupKeyBuilder {

    private final PayerNormalizer payerNormalizer;

    public GroupKeyBuilder(PayerNormalizer payerNormalizer) {
        this.payerNormalizer = payerNormalizer;
    }

    public GroupKey keyFor(CanonicalLine line, boolean includeUnits) {
        return new GroupKey(
                line.payer(),
                line.procedureCode(),
                line.placeOfService(),
                line.modifiers(),
                includeUnits ? line.units() : null);
    }

    /**
     * Key for a hand-entered descriptor, normalized exactly like an input row.
     */
    public GroupKey keyFor(GroupDescriptor descriptor, boolean includeUnits) {
        return new GroupKey(
                payerNormalizer.normalize(descriptor.getPayer()),
                trimmed(descriptor.getCpt()),
                trimmed(descriptor.getPos()),
                RecordNormalizer.normalizeModifiers(descriptor.getModifiers()),
                includeUnits ? RecordNormalizer.normalizeUnits(descriptor.getUnits()) : null);
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
