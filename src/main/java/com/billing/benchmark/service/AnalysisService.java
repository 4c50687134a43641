package com.billing.benchmark.service;

import com.billing.benchmark.config.BenchmarkConfig;
import com.billing.benchmark.config.MetricsConfig;
import com.billing.benchmark.engine.BenchmarkEngine;
import com.billing.benchmark.engine.RecordNormalizer;
import com.billing.benchmark.model.AnalysisResult;
import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.AnalysisSummary;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.model.Issue;
import com.billing.benchmark.model.PaymentStatus;
import com.billing.benchmark.model.RawRecord;
import com.billing.benchmark.repository.OverrideRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the loaded rows and the last analysis result. Every change to rows,
 * settings or overrides goes through this service and triggers a full recompute.
 * Mutations are serialized so a recompute never sees a half-applied change.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final BenchmarkEngine engine;
    private final BenchmarkConfig config;
    private final OverrideRepository overrideRepository;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<List<RawRecord>> rows = new AtomicReference<>(List.of());
    private final AtomicReference<AnalysisResult> lastResult;

    public AnalysisService(BenchmarkEngine engine, BenchmarkConfig config,
                           OverrideRepository overrideRepository, MetricsConfig metricsConfig) {
        this.engine = engine;
        this.config = config;
        this.overrideRepository = overrideRepository;
        this.metricsConfig = metricsConfig;
        this.lastResult = new AtomicReference<>(AnalysisResult.empty(config.snapshot()));
    }

    /**
     * Replace the loaded rows and recompute.
     */
    @Observed(name = "analysis.load", contextualName = "load-billing-rows")
    public synchronized AnalysisResult loadRows(List<RawRecord> records) {
        rows.set(List.copyOf(records));
        log.info("Loaded {} billing rows", records.size());
        return recompute();
    }

    /**
     * Apply a settings change and recompute under the same lock.
     */
    public synchronized AnalysisResult updateSettings(double thresholdPct, BenchmarkMetric benchmark,
                                                      boolean decontaminateChargesProxy, boolean includeUnitsInKey) {
        if (config.isIncludeUnitsInKey() != includeUnitsInKey && !overrideRepository.findAll().isEmpty()) {
            log.warn("Group key variant changed (includeUnitsInKey={}); {} stored overrides no longer match any group",
                    includeUnitsInKey, overrideRepository.findAll().size());
        }
        config.setThresholdPct(thresholdPct);
        config.setBenchmark(benchmark);
        config.setDecontaminateChargesProxy(decontaminateChargesProxy);
        config.setIncludeUnitsInKey(includeUnitsInKey);
        return recompute();
    }

    /**
     * Run an override mutation and recompute under the same lock.
     */
    public synchronized AnalysisResult recomputeAfter(Runnable change) {
        change.run();
        return recompute();
    }

    @Observed(name = "analysis.recompute", contextualName = "recompute-analysis")
    public synchronized AnalysisResult recompute() {
        AnalysisSettings settings = config.snapshot();
        AnalysisResult result = engine.analyze(rows.get(), settings, overrideRepository.findAll());
        lastResult.set(result);

        metricsConfig.recordRecompute(settings.benchmark().name(), result.getLineCount(), result.getGroupStats().size());
        long under = result.countByStatus(PaymentStatus.UNDERPAID);
        long over = result.countByStatus(PaymentStatus.OVERPAID);
        metricsConfig.recordFlagged(PaymentStatus.UNDERPAID.name(), under);
        metricsConfig.recordFlagged(PaymentStatus.OVERPAID.name(), over);

        log.info("Recomputed {} lines in {} groups (benchmark={}, threshold={}%): {} underpaid, {} overpaid",
                result.getLineCount(), result.getGroupStats().size(), settings.benchmark(),
                settings.thresholdPct(), under, over);
        if (result.getDroppedCount() > 0) {
            log.warn("Dropped {} rows without a procedure code", result.getDroppedCount());
        }
        return result;
    }

    /**
     * Drop all rows and results and return to the paid benchmark.
     */
    public synchronized void reset() {
        rows.set(List.of());
        config.setBenchmark(BenchmarkMetric.PAID);
        lastResult.set(AnalysisResult.empty(config.snapshot()));
        log.info("Analysis reset");
    }

    public AnalysisResult getLastResult() {
        return lastResult.get();
    }

    public int getRowCount() {
        return rows.get().size();
    }

    public AnalysisSummary getSummary() {
        return AnalysisSummary.of(lastResult.get());
    }

    /**
     * Issues of the last result matching every given filter; null or blank filters match all.
     *
     * @param payer case-insensitive substring of the normalized payer
     * @param cpt   exact procedure code
     * @param pos   exact place of service
     * @param mods  modifier set, compared after normalization
     */
    public List<Issue> findIssues(String payer, String cpt, String pos, String mods) {
        String payerNeedle = isBlank(payer) ? null : payer.trim().toLowerCase(Locale.ROOT);
        String modsWanted = isBlank(mods) ? null : RecordNormalizer.normalizeModifiers(mods);

        return lastResult.get().getIssues().stream()
                .filter(i -> payerNeedle == null || i.getPayer().toLowerCase(Locale.ROOT).contains(payerNeedle))
                .filter(i -> isBlank(cpt) || i.getProcedureCode().equals(cpt.trim()))
                .filter(i -> isBlank(pos) || i.getPlaceOfService().equals(pos.trim()))
                .filter(i -> modsWanted == null || i.getModifiers().equalsIgnoreCase(modsWanted))
                .toList();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
