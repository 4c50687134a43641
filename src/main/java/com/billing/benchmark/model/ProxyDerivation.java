package com.billing.benchmark.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How a group's proxy came about, attached to every issue of that group.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Derivation trail of a proxy value")
public class ProxyDerivation {

    @Schema(description = "Proxy method, with decontamination marker", example = "mode (tie→max)")
    private String method;

    private boolean decontaminated;

    @Schema(description = "Group size", example = "7")
    private int n;

    private double min;

    private double max;

    private double median;

    private double mean;

    @Schema(description = "Most frequent values (value × count)")
    private List<ValueFrequency> topValues;

    @Schema(description = "Tie or near-tie warning", example = "multi-modal (tie)")
    private String warning;

    public static ProxyDerivation of(GroupStat stat, int topValuesLimit) {
        return ProxyDerivation.builder()
                .method(stat.getMethod().getLabel())
                .decontaminated(stat.isUsedDecontaminate())
                .n(stat.getN())
                .min(stat.getMin())
                .max(stat.getMax())
                .median(stat.getMedian())
                .mean(stat.getMean())
                .topValues(stat.getTopValueFrequencies().stream().limit(topValuesLimit).toList())
                .warning(stat.getWarning())
                .build();
    }

    /**
     * Multi-line human readable rendering, used in exports.
     */
    public String getSummary() {
        String top = topValues == null ? "" : topValues.stream()
                .map(v -> amount(v.value()) + "×" + v.count())
                .collect(Collectors.joining(", "));
        StringBuilder sb = new StringBuilder();
        sb.append("Method: ").append(method).append(decontaminated ? " (cleaned)" : "").append('\n');
        sb.append("Group n: ").append(n).append('\n');
        sb.append("Range: ").append(amount(min)).append(" - ").append(amount(max)).append('\n');
        sb.append("Median: ").append(amount(median)).append("  Mean: ").append(amount(mean)).append('\n');
        sb.append("Top values: ").append(top);
        if (warning != null && !warning.isEmpty()) {
            sb.append('\n').append("Warning: ").append(warning);
        }
        return sb.toString();
    }

    private static String amount(double value) {
        return String.format(Locale.US, "%,.2f", value);
    }
}
