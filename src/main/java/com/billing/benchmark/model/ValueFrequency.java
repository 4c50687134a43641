package com.billing.benchmark.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A cent-rounded amount and how many lines in the group carry it")
public record ValueFrequency(
        @Schema(description = "Amount rounded to cents", example = "100.0") double value,
        @Schema(description = "Number of lines with this amount", example = "3") int count) {
}
