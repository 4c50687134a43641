package com.billing.benchmark.engine;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupKey;
import com.billing.benchmark.model.ProxyMethod;
import com.billing.benchmark.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyResolverTest {

    private static final GroupKey KEY = new GroupKey("Aetna", "99213", "11", "—", null);
    private static final AnalysisSettings ALLOWED = AnalysisSettings.defaults().toBuilder()
            .benchmark(BenchmarkMetric.ALLOWED)
            .build();

    private final ProxyResolver resolver = new ProxyResolver();

    // allowed == charges on the first two lines
    private final List<CanonicalLine> mixed = List.of(
            TestDataFactory.createLine(0, "A", "Aetna", "99213", 150, 150, 0),
            TestDataFactory.createLine(1, "B", "Aetna", "99213", 150, 120, 30),
            TestDataFactory.createLine(2, "C", "Aetna", "99213", 150, 90, 0),
            TestDataFactory.createLine(3, "D", "Aetna", "99213", 150, 70, 0));

    @Test
    void allowedBenchmark_mixedGroup_ignoresLinesBilledAtCharges() {
        ProxyResolution resolution = resolver.resolve(KEY, mixed, ALLOWED, Map.of());

        assertThat(resolution.equalChargesCount()).isEqualTo(2);
        assertThat(resolution.decontaminated()).isTrue();
        assertThat(resolution.value()).isEqualTo(90.0);
        assertThat(resolution.method()).isEqualTo(ProxyMethod.MAX_WHEN_FEW);
    }

    @Test
    void allowedBenchmark_decontaminationOff_usesEveryLine() {
        AnalysisSettings settings = ALLOWED.toBuilder().decontaminateChargesProxy(false).build();

        ProxyResolution resolution = resolver.resolve(KEY, mixed, settings, Map.of());

        assertThat(resolution.decontaminated()).isFalse();
        assertThat(resolution.value()).isEqualTo(150.0);
        assertThat(resolution.method()).isEqualTo(ProxyMethod.MODE);
    }

    @Test
    void allowedBenchmark_everyLineBilledAtCharges_fallsBackToFullList() {
        List<CanonicalLine> all = List.of(
                TestDataFactory.createLine(0, "A", "Aetna", "99213", 150, 150, 0),
                TestDataFactory.createLine(1, "B", "Aetna", "99213", 140, 140, 0),
                TestDataFactory.createLine(2, "C", "Aetna", "99213", 140, 100, 40));

        ProxyResolution resolution = resolver.resolve(KEY, all, ALLOWED, Map.of());

        assertThat(resolution.equalChargesCount()).isEqualTo(3);
        assertThat(resolution.decontaminated()).isTrue();
        assertThat(resolution.value()).isEqualTo(140.0);
    }

    @Test
    void paidBenchmark_neverDecontaminates() {
        ProxyResolution resolution = resolver.resolve(KEY, mixed, AnalysisSettings.defaults(), Map.of());

        assertThat(resolution.decontaminated()).isFalse();
        assertThat(resolution.equalChargesCount()).isEqualTo(2);
        assertThat(resolution.value()).isEqualTo(150.0);
        assertThat(resolution.method()).isEqualTo(ProxyMethod.MODE_TIE_MAX);
    }

    @Test
    void override_winsAndIsRoundedToCents() {
        ProxyResolution resolution = resolver.resolve(KEY, mixed, AnalysisSettings.defaults(),
                Map.of("Aetna|99213|11|—", 45.004));

        assertThat(resolution.value()).isEqualTo(45.0);
        assertThat(resolution.method()).isEqualTo(ProxyMethod.OVERRIDE);
    }

    @Test
    void override_forOtherKeyVariant_isIgnored() {
        ProxyResolution resolution = resolver.resolve(KEY, mixed, AnalysisSettings.defaults(),
                Map.of("Aetna|99213|11|—|1", 45.0));

        assertThat(resolution.method()).isNotEqualTo(ProxyMethod.OVERRIDE);
    }
}
