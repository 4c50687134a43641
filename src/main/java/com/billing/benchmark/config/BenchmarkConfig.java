package com.billing.benchmark.config;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkMetric;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "benchmark")
public class BenchmarkConfig {

    // Variance threshold (±%) outside of which a line is flagged
    private double thresholdPct = 10.0;

    // Allowed range for thresholdPct when changed at runtime
    private double minThresholdPct = 1.0;
    private double maxThresholdPct = 30.0;

    // Which per-line amount is benchmarked: insurer paid or reconstructed allowed
    private BenchmarkMetric benchmark = BenchmarkMetric.PAID;

    // Ignore Allowed == Charges lines in mixed groups when benchmarking allowed
    private boolean decontaminateChargesProxy = true;

    // Include units in the group identity. Changing this orphans stored overrides.
    private boolean includeUnitsInKey = false;

    private double chargesMatchTolerance = 0.01;

    // Second-ranked frequency at or above this share of the top one is a near tie
    private double nearTieRatio = 0.6;

    // Groups at or below this size use the max instead of the mode
    private int thinGroupMaxSize = 2;

    // Proxies below this amount are considered unreliable by the proxy audit
    private double minConfidentProxy = 1.0;

    private int topValuesLimit = 5;

    // Payer name aliases collapsed to one canonical name (substring match, case-insensitive)
    private List<PayerAlias> payerAliases = new ArrayList<>(List.of(PayerAlias.unitedHealthCare()));

    /**
     * Immutable copy of the current settings, handed to the engine for one recompute.
     */
    public AnalysisSettings snapshot() {
        return AnalysisSettings.builder()
                .thresholdPct(thresholdPct)
                .benchmark(benchmark)
                .decontaminateChargesProxy(decontaminateChargesProxy)
                .includeUnitsInKey(includeUnitsInKey)
                .chargesMatchTolerance(chargesMatchTolerance)
                .nearTieRatio(nearTieRatio)
                .thinGroupMaxSize(thinGroupMaxSize)
                .minConfidentProxy(minConfidentProxy)
                .topValuesLimit(topValuesLimit)
                .build();
    }

    @Data
    public static class PayerAlias {
        private String canonicalName;
        private List<String> tokens = new ArrayList<>();

        public static PayerAlias unitedHealthCare() {
            PayerAlias alias = new PayerAlias();
            alias.setCanonicalName("United Health Care");
            alias.setTokens(new ArrayList<>(List.of(
                    "UNITED HEALTH",
                    "UNITED HEALTH CARE",
                    "UNITED HEALTHCARE",
                    "UHC",
                    "UHC – UNITEDHEALTHCARE",
                    "UHC-UNITEDHEALTHCARE",
                    "UHC – UNITED HEALTH CARE",
                    "UNITED HEALTH CARE INSURANCE")));
            return alias;
        }
    }
}
