package com.billing.benchmark.engine;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupStat;
import com.billing.benchmark.model.Issue;
import com.billing.benchmark.model.PaymentStatus;
import com.billing.benchmark.model.ProxyDerivation;
import org.springframework.stereotype.Component;

/**
 * Compares each line's benchmarked amount to its group proxy.
 */
@Component
public class DeviationClassifier {

    /**
     * Percent deviation of {@code metric} from {@code proxy}; 0 when the proxy is 0.
     */
    public static double deviationPct(double metric, double proxy) {
        if (proxy == 0) return 0.0;
        return (metric - proxy) / proxy * 100.0;
    }

    public static PaymentStatus statusFor(double deviationPct, double thresholdPct) {
        if (deviationPct < -thresholdPct) return PaymentStatus.UNDERPAID;
        if (deviationPct > thresholdPct) return PaymentStatus.OVERPAID;
        return PaymentStatus.WITHIN_RANGE;
    }

    public Issue classify(CanonicalLine line, GroupStat group, AnalysisSettings settings) {
        double metric = settings.metricOf(line);
        double deviation = deviationPct(metric, group.getProxy());
        PaymentStatus status = statusFor(deviation, settings.thresholdPct());

        return Issue.builder()
                .lineIndex(line.index())
                .patient(line.patient())
                .serviceDate(line.serviceDate())
                .payer(line.payer())
                .procedureCode(line.procedureCode())
                .placeOfService(line.placeOfService())
                .modifiers(line.modifiers())
                .units(line.units())
                .groupKey(group.getKey())
                .charges(line.charges())
                .metric(metric)
                .proxy(group.getProxy())
                .deviationPct(deviation)
                .status(status)
                .statusLabel(status.label(settings.benchmark()))
                .explanation(explain(status, settings.benchmark()))
                .derivation(ProxyDerivation.of(group, settings.topValuesLimit()))
                .build();
    }

    static String explain(PaymentStatus status, BenchmarkMetric benchmark) {
        boolean paid = benchmark == BenchmarkMetric.PAID;
        return switch (status) {
            case WITHIN_RANGE -> paid
                    ? "Paid aligns with proxy typical payment for same payer/CPT/POS/mods/units."
                    : "Allowed aligns with proxy contracted rate.";
            case UNDERPAID -> paid
                    ? "Paid is below typical. Check missing modifier, bundling, site-of-service, or incorrect units."
                    : "Allowed is below typical for same group.";
            case OVERPAID -> paid
                    ? "Paid is above typical. Could be variant code, bilateral/bundle paid separately, or POS mismatch."
                    : "Allowed is above typical.";
        };
    }
}
