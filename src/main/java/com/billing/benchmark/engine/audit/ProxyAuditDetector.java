package com.billing.benchmark.engine.audit;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupStat;
import com.billing.benchmark.model.PaymentStatus;
import com.billing.benchmark.model.ProxyAuditEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flags overpayments whose proxy is suspect: the line was billed at charges,
 * or the group is too thin or its proxy too small to trust.
 */
@Component
public class ProxyAuditDetector implements AuditDetector<ProxyAuditEntry> {

    static final String NOTE_ALLOWED_EQUALS_CHARGES =
            "This line's Allowed equals Charges — older logic likely used CHARGES as benchmark.";
    static final String NOTE_THIN_GROUP =
            "Proxy built from ≤2 lines — unstable. Consider widening period or grouping.";

    @Override
    public String getName() {
        return "proxy-audit";
    }

    @Override
    public List<ProxyAuditEntry> detect(AuditContext context) {
        AnalysisSettings settings = context.settings();
        List<ProxyAuditEntry> entries = new ArrayList<>();

        for (ClassifiedLine classified : context.classified()) {
            if (classified.issue().getStatus() != PaymentStatus.OVERPAID) {
                continue;
            }
            CanonicalLine line = classified.line();
            GroupStat group = classified.group();

            boolean billedAtCharges = settings.allowedEqualsCharges(line) && line.charges() > 0;
            boolean thinGroup = group.getN() <= settings.thinGroupMaxSize();
            boolean lowConfidence = thinGroup || group.getProxy() < settings.minConfidentProxy();
            if (!billedAtCharges && !lowConfidence) {
                continue;
            }

            String note = billedAtCharges ? NOTE_ALLOWED_EQUALS_CHARGES : thinGroup ? NOTE_THIN_GROUP : "";
            entries.add(ProxyAuditEntry.builder()
                    .patient(line.patient())
                    .serviceDate(line.serviceDate())
                    .payer(line.payer())
                    .procedureCode(line.procedureCode())
                    .placeOfService(line.placeOfService())
                    .modifiers(line.modifiers())
                    .units(line.units())
                    .charges(line.charges())
                    .metric(classified.issue().getMetric())
                    .proxy(group.getProxy())
                    .groupSize(group.getN())
                    .method(group.getMethodLabel())
                    .allowedEqualsCharges(billedAtCharges)
                    .lowConfidenceProxy(lowConfidence)
                    .note(note)
                    .build());
        }

        entries.sort(Comparator.comparingDouble(ProxyAuditEntry::getGap).reversed());
        return entries;
    }
}
