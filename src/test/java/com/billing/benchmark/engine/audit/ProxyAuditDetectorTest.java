package com.billing.benchmark.engine.audit;

import com.billing.benchmark.engine.DeviationClassifier;
import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupStat;
import com.billing.benchmark.model.ProxyAuditEntry;
import com.billing.benchmark.model.ProxyMethod;
import com.billing.benchmark.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyAuditDetectorTest {

    private final ProxyAuditDetector detector = new ProxyAuditDetector();
    private final DeviationClassifier classifier = new DeviationClassifier();

    private ClassifiedLine classify(CanonicalLine line, GroupStat group, AnalysisSettings settings) {
        return new ClassifiedLine(line, group, classifier.classify(line, group, settings));
    }

    @Test
    void overpaidLineInThinGroup_isFlaggedWithThinGroupNote() {
        AnalysisSettings settings = AnalysisSettings.defaults();
        GroupStat thin = TestDataFactory.createGroupStat("Aetna", "99213", 2, 50, ProxyMethod.MAX_WHEN_FEW);
        CanonicalLine line = TestDataFactory.createLine(0, "P", "Aetna", "99213", 200, 80, 0);

        List<ProxyAuditEntry> entries = detector.detect(new AuditContext(
                List.of(line), List.of(classify(line, thin, settings)), settings));

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).isLowConfidenceProxy()).isTrue();
        assertThat(entries.get(0).isAllowedEqualsCharges()).isFalse();
        assertThat(entries.get(0).getNote()).isEqualTo(ProxyAuditDetector.NOTE_THIN_GROUP);
        assertThat(entries.get(0).getGap()).isEqualTo(30.0);
    }

    @Test
    void overpaidLineBilledAtCharges_notePrefersChargesExplanation() {
        AnalysisSettings settings = AnalysisSettings.defaults().toBuilder().benchmark(BenchmarkMetric.ALLOWED).build();
        GroupStat thin = TestDataFactory.createGroupStat("Aetna", "99213", 2, 100, ProxyMethod.MAX_WHEN_FEW);
        CanonicalLine line = TestDataFactory.createLine(0, "P", "Aetna", "99213", 150, 150, 0);

        List<ProxyAuditEntry> entries = detector.detect(new AuditContext(
                List.of(line), List.of(classify(line, thin, settings)), settings));

        assertThat(entries).singleElement()
                .satisfies(e -> {
                    assertThat(e.isAllowedEqualsCharges()).isTrue();
                    assertThat(e.getNote()).isEqualTo(ProxyAuditDetector.NOTE_ALLOWED_EQUALS_CHARGES);
                });
    }

    @Test
    void overpaidLineAgainstTinyProxy_isFlaggedWithoutNote() {
        AnalysisSettings settings = AnalysisSettings.defaults();
        GroupStat group = TestDataFactory.createGroupStat("Aetna", "99213", 6, 0.5, ProxyMethod.MODE);
        CanonicalLine line = TestDataFactory.createLine(0, "P", "Aetna", "99213", 200, 5, 0);

        List<ProxyAuditEntry> entries = detector.detect(new AuditContext(
                List.of(line), List.of(classify(line, group, settings)), settings));

        assertThat(entries).singleElement()
                .satisfies(e -> {
                    assertThat(e.isLowConfidenceProxy()).isTrue();
                    assertThat(e.getNote()).isEmpty();
                });
    }

    @Test
    void overpaidLineInHealthyGroup_isNotFlagged() {
        AnalysisSettings settings = AnalysisSettings.defaults();
        GroupStat group = TestDataFactory.createGroupStat("Aetna", "99213", 8, 100, ProxyMethod.MODE);
        CanonicalLine line = TestDataFactory.createLine(0, "P", "Aetna", "99213", 200, 150, 0);

        assertThat(detector.detect(new AuditContext(
                List.of(line), List.of(classify(line, group, settings)), settings))).isEmpty();
    }

    @Test
    void underpaidLines_areIgnored() {
        AnalysisSettings settings = AnalysisSettings.defaults();
        GroupStat thin = TestDataFactory.createGroupStat("Aetna", "99213", 1, 100, ProxyMethod.MAX_WHEN_FEW);
        CanonicalLine line = TestDataFactory.createLine(0, "P", "Aetna", "99213", 200, 20, 0);

        assertThat(detector.detect(new AuditContext(
                List.of(line), List.of(classify(line, thin, settings)), settings))).isEmpty();
    }

    @Test
    void entries_sortedByGapDescending() {
        AnalysisSettings settings = AnalysisSettings.defaults();
        GroupStat thin = TestDataFactory.createGroupStat("Aetna", "99213", 2, 50, ProxyMethod.MAX_WHEN_FEW);
        CanonicalLine small = TestDataFactory.createLine(0, "SMALL", "Aetna", "99213", 200, 60, 0);
        CanonicalLine large = TestDataFactory.createLine(1, "LARGE", "Aetna", "99213", 200, 120, 0);

        List<ProxyAuditEntry> entries = detector.detect(new AuditContext(List.of(small, large),
                List.of(classify(small, thin, settings), classify(large, thin, settings)), settings));

        assertThat(entries).extracting(ProxyAuditEntry::getPatient).containsExactly("LARGE", "SMALL");
    }
}
