package com.billing.benchmark.engine.audit;

import com.billing.benchmark.engine.Amounts;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.PatientAggregate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Patients whose lines carry charges but no insurer payment at all.
 *
 * The gap is measured against the active benchmark total, so under the paid
 * benchmark it is always 0 for a qualifying patient.
 */
@Component
public class UnpaidPatientDetector implements AuditDetector<PatientAggregate> {

    @Override
    public String getName() {
        return "unpaid-patients";
    }

    @Override
    public List<PatientAggregate> detect(AuditContext context) {
        Map<String, Totals> byPatient = new LinkedHashMap<>();
        for (CanonicalLine line : context.lines()) {
            byPatient.computeIfAbsent(line.patient(), p -> new Totals()).add(line);
        }

        boolean paidBenchmark = context.settings().benchmark() == BenchmarkMetric.PAID;
        List<PatientAggregate> result = new ArrayList<>();
        byPatient.forEach((patient, totals) -> {
            if (totals.insurancePaid != 0 || totals.charges <= 0) {
                return;
            }
            double benchmarked = paidBenchmark ? totals.insurancePaid : totals.allowed;
            result.add(PatientAggregate.builder()
                    .patient(patient)
                    .payers(String.join(", ", totals.payers))
                    .lineCount(totals.lines)
                    .totalCharges(Amounts.round2(totals.charges))
                    .totalAllowed(Amounts.round2(totals.allowed))
                    .totalInsurancePaid(Amounts.round2(totals.insurancePaid))
                    .totalBalance(Amounts.round2(totals.balance))
                    .unpaidGap(Amounts.round2(Math.max(0, benchmarked - totals.insurancePaid)))
                    .build());
        });

        result.sort(Comparator.comparingDouble(PatientAggregate::getUnpaidGap).reversed());
        return result;
    }

    private static final class Totals {
        private final Set<String> payers = new LinkedHashSet<>();
        private int lines;
        private double charges;
        private double allowed;
        private double insurancePaid;
        private double balance;

        void add(CanonicalLine line) {
            payers.add(line.payer());
            lines++;
            charges += line.charges();
            allowed += line.allowed();
            insurancePaid += line.insurancePaid();
            balance += line.balance();
        }
    }
}
