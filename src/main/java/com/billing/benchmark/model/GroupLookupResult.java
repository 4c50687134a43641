package com.billing.benchmark.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Proxy and derivation for a looked-up group, or a not-found marker")
public class GroupLookupResult {

    private String payer;

    private String procedureCode;

    private String placeOfService;

    private String modifiers;

    private String units;

    @Schema(description = "Key the descriptor resolved to under the active key variant", example = "Aetna|99213|11|—")
    private String key;

    @Schema(description = "Whether a group with this key exists in the last result", example = "true")
    private boolean found;

    private Double proxy;

    @Schema(description = "Proxy method, with decontamination marker", example = "mode")
    private String method;

    private Integer n;

    private Integer equalChargesCount;

    @Schema(description = "Min - max of the group's benchmarked amounts", example = "60.00 - 82.00")
    private String range;

    private List<ValueFrequency> topValues;

    private String message;
}
