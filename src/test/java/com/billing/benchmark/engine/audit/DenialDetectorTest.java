package com.billing.benchmark.engine.audit;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.DenialEntry;
import com.billing.benchmark.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DenialDetectorTest {

    private final DenialDetector detector = new DenialDetector();

    private static CanonicalLine writeOff(int index, String patient) {
        return TestDataFactory.createLine(index, patient, "Aetna", "99213", 200, 0, 0)
                .toBuilder().adjustment(-200).build();
    }

    @Test
    void fullWriteOff_isDeniedUnderEitherBenchmark() {
        List<CanonicalLine> lines = List.of(writeOff(0, "P"));
        AnalysisSettings allowed = AnalysisSettings.defaults().toBuilder().benchmark(BenchmarkMetric.ALLOWED).build();

        List<DenialEntry> paid = detector.detect(new AuditContext(lines, List.of(), AnalysisSettings.defaults()));
        List<DenialEntry> allowedEntries = detector.detect(new AuditContext(lines, List.of(), allowed));

        assertThat(paid).singleElement().satisfies(d -> {
            assertThat(d.isFullWriteOff()).isTrue();
            assertThat(d.isZeroMetric()).isTrue();
        });
        assertThat(allowedEntries).hasSize(1);
    }

    @Test
    void zeroPaidWithBalance_isDeniedOnlyUnderPaidBenchmark() {
        List<CanonicalLine> lines = List.of(TestDataFactory.createLine(0, "P", "Aetna", "99213", 200, 0, 120));
        AnalysisSettings allowed = AnalysisSettings.defaults().toBuilder().benchmark(BenchmarkMetric.ALLOWED).build();

        List<DenialEntry> paid = detector.detect(new AuditContext(lines, List.of(), AnalysisSettings.defaults()));

        assertThat(paid).singleElement().satisfies(d -> {
            assertThat(d.isFullWriteOff()).isFalse();
            assertThat(d.isZeroMetric()).isTrue();
        });
        assertThat(detector.detect(new AuditContext(lines, List.of(), allowed))).isEmpty();
    }

    @Test
    void paidLinesAndZeroChargeLines_areNotDenials() {
        List<CanonicalLine> lines = List.of(
                TestDataFactory.createLine(0, "A", "Aetna", "99213", 200, 90, 0),
                TestDataFactory.createLine(1, "B", "Aetna", "99213", 0, 0, 0));

        assertThat(detector.detect(new AuditContext(lines, List.of(), AnalysisSettings.defaults()))).isEmpty();
    }

    @Test
    void denials_keepArrivalOrder() {
        List<CanonicalLine> lines = List.of(writeOff(0, "Z"), writeOff(1, "A"), writeOff(2, "M"));

        assertThat(detector.detect(new AuditContext(lines, List.of(), AnalysisSettings.defaults())))
                .extracting(DenialEntry::getPatient)
                .containsExactly("Z", "A", "M");
    }
}
