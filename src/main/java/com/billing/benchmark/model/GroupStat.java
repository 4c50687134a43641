package com.billing.benchmark.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Distribution statistics and resolved proxy for one payer × CPT × POS × modifiers (× units) group")
public class GroupStat {

    @JsonIgnore
    private GroupKey groupKey;

    @Schema(description = "Group key label, also used as the override key", example = "Aetna|99213|11|25")
    private String key;

    @Schema(description = "Normalized payer name", example = "Aetna")
    private String payer;

    @Schema(description = "Procedure code", example = "99213")
    private String procedureCode;

    @Schema(description = "Place-of-service code", example = "11")
    private String placeOfService;

    @Schema(description = "Normalized modifier set", example = "25+59")
    private String modifiers;

    @Schema(description = "Units of the first line in the group", example = "1")
    private String units;

    @Schema(description = "Number of lines in the group", example = "12")
    private int n;

    @Schema(description = "Resolved baseline value", example = "74.16")
    private double proxy;

    @Schema(description = "How the proxy was derived", example = "mode")
    private ProxyMethod method;

    @Schema(description = "Median of the unfiltered benchmark values", example = "74.16")
    private double median;

    @Schema(description = "Mean of the unfiltered benchmark values", example = "72.90")
    private double mean;

    private double min;

    private double max;

    @JsonProperty("nEqCharges")
    @Schema(description = "Lines whose allowed amount equals charges (within a cent)", example = "0")
    private int equalChargesCount;

    @Schema(description = "Decontamination was active for this group", example = "false")
    private boolean usedDecontaminate;

    @Schema(description = "Cent-rounded values ranked by frequency, then by amount")
    @Builder.Default
    private List<ValueFrequency> topValueFrequencies = new ArrayList<>();

    @Schema(description = "Top two frequencies are equal", example = "false")
    private boolean multiModal;

    @Schema(description = "Second frequency is at least 60% of the top one", example = "false")
    private boolean nearTie;

    @Schema(description = "Method with decontamination marker", example = "mode + decontaminated")
    public String getMethodLabel() {
        return method + (usedDecontaminate ? " + decontaminated" : "");
    }

    @Schema(description = "Distribution warning, empty when the distribution is clear", example = "near tie")
    public String getWarning() {
        if (multiModal) return "multi-modal (tie)";
        if (nearTie) return "near tie";
        return "";
    }
}
