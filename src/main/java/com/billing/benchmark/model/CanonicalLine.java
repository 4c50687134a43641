package com.billing.benchmark.model;

import lombok.Builder;

/**
 * A normalized billing line. Amounts are non-negative except the adjustment,
 * which keeps its source sign (write-offs are negative).
 */
@Builder(toBuilder = true)
public record CanonicalLine(
        int index,
        String payer,
        String procedureCode,
        String placeOfService,
        String modifiers,
        String units,
        String patient,
        String serviceDate,
        double charges,
        double insurancePaid,
        double patientPaid,
        double balance,
        double allowed,
        double adjustment) {
}
