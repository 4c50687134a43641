package com.billing.benchmark.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a benchmark group. {@code units} is null when units are not part of the key.
 * Equality is structural; {@link #label()} is only a display and persistence form.
 */
public record GroupKey(String payer, String procedureCode, String placeOfService, String modifiers, String units) {

    public static final String LABEL_SEPARATOR = "|";

    public static final Comparator<GroupKey> DISPLAY_ORDER = Comparator
            .comparing(GroupKey::payer, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(GroupKey::payer)
            .thenComparing(GroupKey::procedureCode, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(GroupKey::procedureCode)
            .thenComparing(GroupKey::placeOfService)
            .thenComparing(GroupKey::modifiers)
            .thenComparing(k -> Objects.toString(k.units(), ""));

    public GroupKey {
        Objects.requireNonNull(payer, "payer");
        Objects.requireNonNull(procedureCode, "procedureCode");
        Objects.requireNonNull(placeOfService, "placeOfService");
        Objects.requireNonNull(modifiers, "modifiers");
    }

    public boolean includesUnits() {
        return units != null;
    }

    public String label() {
        String base = String.join(LABEL_SEPARATOR, payer, procedureCode, placeOfService, modifiers);
        return includesUnits() ? base + LABEL_SEPARATOR + units : base;
    }

    @Override
    public String toString() {
        return label();
    }
}
