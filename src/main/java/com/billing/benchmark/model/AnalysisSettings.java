package com.billing.benchmark.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

/**
 * Immutable snapshot of every parameter that influences a recompute.
 * Two recomputes over the same rows, settings and overrides produce identical output.
 */
@Builder(toBuilder = true)
@Schema(description = "Parameters of one analysis run")
public record AnalysisSettings(
        @Schema(description = "Variance threshold in percent", example = "10.0")
        double thresholdPct,
        @Schema(description = "Benchmarked amount", example = "PAID")
        BenchmarkMetric benchmark,
        @Schema(description = "Ignore Allowed == Charges lines in mixed groups (allowed benchmark only)", example = "true")
        boolean decontaminateChargesProxy,
        @Schema(description = "Whether units are part of the group key", example = "false")
        boolean includeUnitsInKey,
        double chargesMatchTolerance,
        double nearTieRatio,
        int thinGroupMaxSize,
        double minConfidentProxy,
        int topValuesLimit) {

    public static AnalysisSettings defaults() {
        return AnalysisSettings.builder()
                .thresholdPct(10.0)
                .benchmark(BenchmarkMetric.PAID)
                .decontaminateChargesProxy(true)
                .includeUnitsInKey(false)
                .chargesMatchTolerance(0.01)
                .nearTieRatio(0.6)
                .thinGroupMaxSize(2)
                .minConfidentProxy(1.0)
                .topValuesLimit(5)
                .build();
    }

    public double metricOf(CanonicalLine line) {
        return benchmark.valueOf(line);
    }

    public boolean allowedEqualsCharges(CanonicalLine line) {
        return Math.abs(line.allowed() - line.charges()) < chargesMatchTolerance;
    }
}
