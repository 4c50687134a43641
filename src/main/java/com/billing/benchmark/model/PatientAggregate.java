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
@Schema(description = "Totals for a patient that received no insurer payment at all")
public class PatientAggregate {

    private String patient;

    @Schema(description = "Distinct payers on the patient's lines, comma separated", example = "Aetna, United Health Care")
    private String payers;

    private int lineCount;

    private double totalCharges;

    private double totalAllowed;

    private double totalInsurancePaid;

    private double totalBalance;

    @Schema(description = "max(0, benchmarked total - insurer paid total)", example = "240.00")
    private double unpaidGap;
}
