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
@Schema(description = "Raw description of a benchmark group, normalized the same way as input rows")
public class GroupDescriptor {

    @Schema(description = "Payer name (aliases are collapsed)", example = "UHC - UnitedHealthcare")
    private String payer;

    @Schema(description = "Procedure code", example = "11042")
    private String cpt;

    @Schema(description = "Place-of-service code", example = "11")
    private String pos;

    @Schema(description = "Modifiers, comma/space separated or joined with +; blank or — for none", example = "59")
    private String modifiers;

    @Schema(description = "Units; only used when units are part of the key. Defaults to 1", example = "1")
    private String units;
}
