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
@Schema(description = "An overpayment whose proxy is of doubtful quality")
public class ProxyAuditEntry {

    private String patient;

    private String serviceDate;

    private String payer;

    private String procedureCode;

    private String placeOfService;

    private String modifiers;

    private String units;

    private double charges;

    private double metric;

    private double proxy;

    @Schema(description = "Lines in the group", example = "2")
    private int groupSize;

    @Schema(description = "Proxy method, with decontamination marker", example = "max_when_few")
    private String method;

    @Schema(description = "This line's allowed amount equals its charges", example = "false")
    private boolean allowedEqualsCharges;

    @Schema(description = "Group has too few lines or the proxy is below one currency unit", example = "true")
    private boolean lowConfidenceProxy;

    @Schema(description = "Why the line was flagged")
    private String note;

    public double getGap() {
        return Math.abs(metric - proxy);
    }
}
