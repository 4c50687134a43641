package com.billing.benchmark.service;

import com.billing.benchmark.config.BenchmarkConfig;
import com.billing.benchmark.config.MetricsConfig;
import com.billing.benchmark.engine.GroupKeyBuilder;
import com.billing.benchmark.engine.PayerNormalizer;
import com.billing.benchmark.model.AnalysisResult;
import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.GroupDescriptor;
import com.billing.benchmark.model.OverrideRequest;
import com.billing.benchmark.repository.OverrideRepository;
import com.billing.benchmark.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OverrideServiceTest {

    @Mock
    private OverrideRepository overrideRepository;

    @Mock
    private AnalysisService analysisService;

    @Mock
    private MetricsConfig metricsConfig;

    private BenchmarkConfig config;
    private OverrideService service;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.createConfig();
        GroupKeyBuilder keyBuilder = new GroupKeyBuilder(new PayerNormalizer(config));
        service = new OverrideService(overrideRepository, keyBuilder, config, analysisService, metricsConfig);
    }

    private void runMutationsInline() {
        when(analysisService.recomputeAfter(any())).thenAnswer(inv -> {
            inv.<Runnable>getArgument(0).run();
            return AnalysisResult.empty(AnalysisSettings.defaults());
        });
    }

    @Test
    void init_loadsStoredOverrides() {
        when(overrideRepository.loadAll()).thenReturn(Map.of("Aetna|99213|11|—", 45.0));

        service.init();

        verify(metricsConfig).updateActiveOverrides(1);
    }

    @Test
    void keyFor_normalizesDescriptor() {
        GroupDescriptor descriptor = TestDataFactory.createDescriptor(" uhc ", " 99213 ", "11", "59, 25");

        assertThat(service.keyFor(descriptor).label()).isEqualTo("United Health Care|99213|11|25+59");
    }

    @Test
    void keyFor_includesUnitsOnlyWhenConfigured() {
        GroupDescriptor descriptor = TestDataFactory.createDescriptor("Aetna", "97110", "11", "");
        descriptor.setUnits("");
        config.setIncludeUnitsInKey(true);

        assertThat(service.keyFor(descriptor).label()).isEqualTo("Aetna|97110|11|—|1");
    }

    @Test
    void keyFor_blankRequiredField_throws() {
        assertThatThrownBy(() -> service.keyFor(TestDataFactory.createDescriptor("Aetna", " ", "11", "")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cpt");
        assertThatThrownBy(() -> service.keyFor(TestDataFactory.createDescriptor("", "99213", "11", "")))
                .hasMessageContaining("payer");
        assertThatThrownBy(() -> service.keyFor(TestDataFactory.createDescriptor("Aetna", "99213", null, "")))
                .hasMessageContaining("pos");
        assertThatThrownBy(() -> service.keyFor(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void apply_persistsAndRecomputes() {
        runMutationsInline();
        when(overrideRepository.findAll()).thenReturn(Map.of("Aetna|99213|11|—", 45.0));

        service.apply(OverrideRequest.builder()
                .group(TestDataFactory.createDescriptor("Aetna", "99213", "11", ""))
                .amount("$45.00")
                .build());

        verify(overrideRepository).set("Aetna|99213|11|—", 45.0);
        verify(metricsConfig).recordOverrideChange("apply");
        verify(metricsConfig).updateActiveOverrides(1);
    }

    @Test
    void apply_nonNumericAmount_isRejectedWithoutTouchingStore() {
        OverrideRequest request = OverrideRequest.builder()
                .group(TestDataFactory.createDescriptor("Aetna", "99213", "11", ""))
                .amount("forty")
                .build();

        assertThatThrownBy(() -> service.apply(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("amount");
        verify(overrideRepository, never()).set(anyString(), anyDouble());
        verifyNoInteractions(analysisService);
    }

    @Test
    void clear_deletesExistingOverride() {
        runMutationsInline();
        when(overrideRepository.delete("Aetna|99213|11|—")).thenReturn(true);
        when(overrideRepository.findAll()).thenReturn(Map.of());

        service.clear(TestDataFactory.createDescriptor("Aetna", "99213", "11", null));

        verify(metricsConfig).recordOverrideChange("clear");
        verify(metricsConfig).updateActiveOverrides(0);
    }

    @Test
    void clear_missingOverride_stillRecomputesWithoutMetric() {
        runMutationsInline();
        when(overrideRepository.delete(anyString())).thenReturn(false);

        service.clear(TestDataFactory.createDescriptor("Aetna", "99213", "11", null));

        verify(analysisService).recomputeAfter(any());
        verify(metricsConfig, never()).recordOverrideChange(anyString());
    }

    @Test
    void clearAll_emptiesStore() {
        runMutationsInline();
        when(overrideRepository.findAll()).thenReturn(Map.of("a", 1.0, "b", 2.0), Map.of());

        service.clearAll();

        verify(overrideRepository).clearAll();
        verify(metricsConfig).recordOverrideChange("clear_all");
        verify(metricsConfig).updateActiveOverrides(0);
    }
}
