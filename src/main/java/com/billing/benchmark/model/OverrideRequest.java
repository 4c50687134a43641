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
@Schema(description = "Manual proxy for one group")
public class OverrideRequest {

    @Schema(description = "Group the override applies to")
    private GroupDescriptor group;

    @Schema(description = "Override amount; must be a finite number", example = "45.00")
    private String amount;
}
