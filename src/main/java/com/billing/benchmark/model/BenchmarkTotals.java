package com.billing.benchmark.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Portfolio level totals")
public class BenchmarkTotals {

    @Schema(description = "Sum of insurer payments over all lines", example = "15234.50")
    private double totalInsurancePaid;

    @Schema(description = "Sum of the benchmarked amount over all lines", example = "15234.50")
    private double totalActual;

    @Schema(description = "Sum of proxy × n over all groups", example = "16010.00")
    private double totalExpected;

    @Schema(description = "Expected minus actual", example = "775.50")
    private double deltaExpectedMinusActual;

    @Schema(description = "Label of the benchmarked amount", example = "Paid")
    private String benchmarkLabel;

    public static BenchmarkTotals empty(BenchmarkMetric benchmark) {
        return BenchmarkTotals.builder().benchmarkLabel(benchmark.getLabel()).build();
    }
}
