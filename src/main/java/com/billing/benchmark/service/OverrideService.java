package com.billing.benchmark.service;

import com.billing.benchmark.config.BenchmarkConfig;
import com.billing.benchmark.config.MetricsConfig;
import com.billing.benchmark.engine.Amounts;
import com.billing.benchmark.engine.GroupKeyBuilder;
import com.billing.benchmark.model.AnalysisResult;
import com.billing.benchmark.model.GroupDescriptor;
import com.billing.benchmark.model.GroupKey;
import com.billing.benchmark.model.OverrideRequest;
import com.billing.benchmark.repository.OverrideRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Manual proxy overrides keyed by group label. Each change is persisted and
 * followed by a recompute; invalid input leaves the stored overrides untouched.
 */
@Service
public class OverrideService {

    private static final Logger log = LoggerFactory.getLogger(OverrideService.class);

    private final OverrideRepository overrideRepository;
    private final GroupKeyBuilder keyBuilder;
    private final BenchmarkConfig config;
    private final AnalysisService analysisService;
    private final MetricsConfig metricsConfig;

    public OverrideService(OverrideRepository overrideRepository, GroupKeyBuilder keyBuilder,
                           BenchmarkConfig config, AnalysisService analysisService,
                           MetricsConfig metricsConfig) {
        this.overrideRepository = overrideRepository;
        this.keyBuilder = keyBuilder;
        this.config = config;
        this.analysisService = analysisService;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        Map<String, Double> loaded = overrideRepository.loadAll();
        metricsConfig.updateActiveOverrides(loaded.size());
        log.info("Loaded {} proxy overrides", loaded.size());
    }

    public Map<String, Double> findAll() {
        return overrideRepository.findAll();
    }

    /**
     * Key the descriptor maps to under the active key variant.
     *
     * @throws IllegalArgumentException when payer, CPT or POS is blank
     */
    public GroupKey keyFor(GroupDescriptor descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("group is required");
        }
        GroupKey key = keyBuilder.keyFor(descriptor, config.isIncludeUnitsInKey());
        if (key.payer().isEmpty()) throw new IllegalArgumentException("payer is required");
        if (key.procedureCode().isEmpty()) throw new IllegalArgumentException("cpt is required");
        if (key.placeOfService().isEmpty()) throw new IllegalArgumentException("pos is required");
        return key;
    }

    public AnalysisResult apply(OverrideRequest request) {
        GroupKey key = keyFor(request.getGroup());
        double amount = Amounts.parseStrict(request.getAmount())
                .orElseThrow(() -> new IllegalArgumentException("amount must be a finite number"));

        return analysisService.recomputeAfter(() -> {
            overrideRepository.set(key.label(), amount);
            afterChange("apply");
            log.info("Override set: {} = {}", key.label(), amount);
        });
    }

    public AnalysisResult clear(GroupDescriptor descriptor) {
        GroupKey key = keyFor(descriptor);
        return analysisService.recomputeAfter(() -> {
            if (overrideRepository.delete(key.label())) {
                afterChange("clear");
                log.info("Override cleared: {}", key.label());
            } else {
                log.debug("No override to clear for {}", key.label());
            }
        });
    }

    public AnalysisResult clearAll() {
        return analysisService.recomputeAfter(() -> {
            int count = overrideRepository.findAll().size();
            overrideRepository.clearAll();
            afterChange("clear_all");
            log.info("Cleared all {} overrides", count);
        });
    }

    private void afterChange(String action) {
        metricsConfig.recordOverrideChange(action);
        metricsConfig.updateActiveOverrides(overrideRepository.findAll().size());
    }
}
