package com.billing.benchmark.engine.audit;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.PatientAggregate;
import com.billing.benchmark.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UnpaidPatientDetectorTest {

    private static final AnalysisSettings ALLOWED =
            AnalysisSettings.defaults().toBuilder().benchmark(BenchmarkMetric.ALLOWED).build();

    private final UnpaidPatientDetector detector = new UnpaidPatientDetector();

    private final List<CanonicalLine> lines = List.of(
            TestDataFactory.createLine(0, "DOE, JANE", "Aetna", "99213", 100, 0, 60),
            TestDataFactory.createLine(1, "SMITH, JOHN", "Aetna", "99213", 100, 80, 0),
            TestDataFactory.createLine(2, "DOE, JANE", "Cigna", "97110", 200, 0, 90),
            TestDataFactory.createLine(3, "ROE, RICHARD", "Aetna", "99213", 50, 0, 10),
            TestDataFactory.createLine(4, "DOE, JANE", "Aetna", "99214", 0, 0, 0));

    @Test
    void allowedBenchmark_gapIsAllowedTotalAndSortedDescending() {
        List<PatientAggregate> result = detector.detect(new AuditContext(lines, List.of(), ALLOWED));

        assertThat(result).extracting(PatientAggregate::getPatient).containsExactly("DOE, JANE", "ROE, RICHARD");

        PatientAggregate jane = result.get(0);
        assertThat(jane.getLineCount()).isEqualTo(3);
        assertThat(jane.getPayers()).isEqualTo("Aetna, Cigna");
        assertThat(jane.getTotalCharges()).isEqualTo(300.0);
        assertThat(jane.getTotalAllowed()).isEqualTo(150.0);
        assertThat(jane.getTotalInsurancePaid()).isEqualTo(0.0);
        assertThat(jane.getTotalBalance()).isEqualTo(150.0);
        assertThat(jane.getUnpaidGap()).isEqualTo(150.0);
    }

    @Test
    void paidBenchmark_gapIsAlwaysZero() {
        List<PatientAggregate> result = detector.detect(new AuditContext(lines, List.of(), AnalysisSettings.defaults()));

        assertThat(result).hasSize(2);
        assertThat(result).allSatisfy(p -> assertThat(p.getUnpaidGap()).isEqualTo(0.0));
        // Stable sort keeps first-seen order on equal gaps
        assertThat(result).extracting(PatientAggregate::getPatient).containsExactly("DOE, JANE", "ROE, RICHARD");
    }

    @Test
    void patientWithoutCharges_doesNotQualify() {
        List<CanonicalLine> free = List.of(TestDataFactory.createLine(0, "P", "Aetna", "99213", 0, 0, 0));

        assertThat(detector.detect(new AuditContext(free, List.of(), ALLOWED))).isEmpty();
    }
}
