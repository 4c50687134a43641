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
@Schema(description = "A line that was fully denied or written off")
public class DenialEntry {

    private String patient;

    private String serviceDate;

    private String payer;

    private String procedureCode;

    private String placeOfService;

    private String modifiers;

    private String units;

    private double charges;

    private double insurancePaid;

    private double adjustment;

    @Schema(description = "Adjustment cancels the full charge with nothing paid or owed", example = "true")
    private boolean fullWriteOff;

    @Schema(description = "Benchmarked amount is exactly zero", example = "true")
    private boolean zeroMetric;
}
