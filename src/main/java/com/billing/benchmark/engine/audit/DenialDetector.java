package com.billing.benchmark.engine.audit;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.DenialEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lines that were fully written off, or whose benchmarked amount is zero despite a charge.
 * Findings keep arrival order.
 */
@Component
public class DenialDetector implements AuditDetector<DenialEntry> {

    @Override
    public String getName() {
        return "denials";
    }

    @Override
    public List<DenialEntry> detect(AuditContext context) {
        AnalysisSettings settings = context.settings();
        double tolerance = settings.chargesMatchTolerance();
        List<DenialEntry> entries = new ArrayList<>();

        for (CanonicalLine line : context.lines()) {
            boolean fullWriteOff = line.charges() > 0
                    && Math.abs(line.adjustment() + line.charges()) < tolerance
                    && line.insurancePaid() == 0
                    && line.balance() == 0;
            boolean zeroMetric = settings.metricOf(line) == 0 && line.charges() > 0;

            if (fullWriteOff || zeroMetric) {
                entries.add(DenialEntry.builder()
                        .patient(line.patient())
                        .serviceDate(line.serviceDate())
                        .payer(line.payer())
                        .procedureCode(line.procedureCode())
                        .placeOfService(line.placeOfService())
                        .modifiers(line.modifiers())
                        .units(line.units())
                        .charges(line.charges())
                        .insurancePaid(line.insurancePaid())
                        .adjustment(line.adjustment())
                        .fullWriteOff(fullWriteOff)
                        .zeroMetric(zeroMetric)
                        .build());
            }
        }
        return entries;
    }
}
