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
@Schema(description = "Classification of a single billing line against its group proxy")
public class Issue {

    @Schema(description = "Position of the line in the loaded rows (after dropping rows without CPT)", example = "0")
    private int lineIndex;

    @Schema(description = "Patient name", example = "DOE, JANE")
    private String patient;

    @Schema(description = "Date of service", example = "03/14/2024")
    private String serviceDate;

    private String payer;

    private String procedureCode;

    private String placeOfService;

    private String modifiers;

    private String units;

    @Schema(description = "Group key label", example = "Aetna|99213|11|—")
    private String groupKey;

    private double charges;

    @Schema(description = "Benchmarked amount for this line (paid or allowed)", example = "81.20")
    private double metric;

    private double proxy;

    @Schema(description = "Deviation from the proxy in percent; 0 when the proxy is 0", example = "-12.4")
    private double deviationPct;

    private PaymentStatus status;

    @Schema(description = "Status label", example = "Underpaid")
    private String statusLabel;

    private String explanation;

    private ProxyDerivation derivation;
}
