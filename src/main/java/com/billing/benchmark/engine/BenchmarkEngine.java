package com.billing.benchmark.engine;

import com.billing.benchmark.engine.audit.AuditContext;
import com.billing.benchmark.engine.audit.AuditDetector;
import com.billing.benchmark.engine.audit.ClassifiedLine;
import com.billing.benchmark.engine.audit.DenialDetector;
import com.billing.benchmark.engine.audit.ProxyAuditDetector;
import com.billing.benchmark.engine.audit.UnpaidPatientDetector;
import com.billing.benchmark.model.AnalysisResult;
import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.BenchmarkTotals;
import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.DenialEntry;
import com.billing.benchmark.model.GroupKey;
import com.billing.benchmark.model.GroupStat;
import com.billing.benchmark.model.Issue;
import com.billing.benchmark.model.PatientAggregate;
import com.billing.benchmark.model.ProxyAuditEntry;
import com.billing.benchmark.model.RawRecord;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the full analysis pipeline over a set of raw rows:
 * normalize, group, resolve proxies, classify lines, then audit.
 *
 * The engine is stateless. Every call recomputes everything from its arguments,
 * so identical inputs always yield identical results.
 */
@Component
public class BenchmarkEngine {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkEngine.class);

    static final Comparator<Issue> ISSUE_ORDER = Comparator
            .comparing((Issue i) -> !i.getStatus().isFlagged())
            .thenComparing(Comparator.comparingDouble((Issue i) -> Math.abs(i.getDeviationPct())).reversed());

    private final RecordNormalizer normalizer;
    private final GroupAggregator aggregator;
    private final ProxyResolver proxyResolver;
    private final DeviationClassifier classifier;
    private final ProxyAuditDetector proxyAuditDetector;
    private final DenialDetector denialDetector;
    private final UnpaidPatientDetector unpaidPatientDetector;
    private final Tracer tracer;

    public BenchmarkEngine(RecordNormalizer normalizer, GroupAggregator aggregator,
                           ProxyResolver proxyResolver, DeviationClassifier classifier,
                           ProxyAuditDetector proxyAuditDetector, DenialDetector denialDetector,
                           UnpaidPatientDetector unpaidPatientDetector, Tracer tracer) {
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.proxyResolver = proxyResolver;
        this.classifier = classifier;
        this.proxyAuditDetector = proxyAuditDetector;
        this.denialDetector = denialDetector;
        this.unpaidPatientDetector = unpaidPatientDetector;
        this.tracer = tracer;
    }

    /**
     * Analyze the given rows.
     *
     * @param records   raw rows in arrival order
     * @param settings  snapshot of the active settings
     * @param overrides manual proxy overrides by group key label
     * @return a complete, self-contained result
     */
    @Observed(name = "benchmark.analyze", contextualName = "analyze-billing-lines")
    public AnalysisResult analyze(List<RawRecord> records, AnalysisSettings settings, Map<String, Double> overrides) {
        // Step 1: normalize
        List<CanonicalLine> lines = inSpan("benchmark.normalize", () -> normalizer.normalizeAll(records));
        if (lines.isEmpty()) {
            AnalysisResult empty = AnalysisResult.empty(settings);
            empty.setRecordCount(records.size());
            empty.setDroppedCount(records.size());
            return empty;
        }

        // Step 2: group, describe and resolve proxies
        Map<GroupKey, GroupStat> groups = new LinkedHashMap<>();
        Map<GroupKey, List<CanonicalLine>> buckets = inSpan("benchmark.group", () -> {
            Map<GroupKey, List<CanonicalLine>> b = aggregator.bucket(lines, settings);
            b.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey(GroupKey.DISPLAY_ORDER))
                    .forEach(e -> groups.put(e.getKey(), resolveGroup(e.getKey(), e.getValue(), settings, overrides)));
            return b;
        });

        // Step 3: classify every line against its group proxy
        List<ClassifiedLine> classified = inSpan("benchmark.classify", () -> {
            List<ClassifiedLine> out = new ArrayList<>(lines.size());
            groups.forEach((key, group) -> {
                for (CanonicalLine line : buckets.get(key)) {
                    out.add(new ClassifiedLine(line, group, classifier.classify(line, group, settings)));
                }
            });
            return out;
        });

        List<Issue> issues = new ArrayList<>(classified.stream().map(ClassifiedLine::issue).toList());
        issues.sort(ISSUE_ORDER);

        // Step 4: audits
        AuditContext context = new AuditContext(lines, classified, settings);
        List<ProxyAuditEntry> proxyAudits = runAudit(proxyAuditDetector, context);
        List<DenialEntry> denials = runAudit(denialDetector, context);
        List<PatientAggregate> unpaidPatients = runAudit(unpaidPatientDetector, context);

        BenchmarkTotals totals = totals(lines, groups.values(), settings);

        log.debug("Analyzed {} lines in {} groups: {} flagged, {} proxy audits, {} denials, {} unpaid patients",
                lines.size(), groups.size(), issues.stream().filter(i -> i.getStatus().isFlagged()).count(),
                proxyAudits.size(), denials.size(), unpaidPatients.size());

        return AnalysisResult.builder()
                .settings(settings)
                .recordCount(records.size())
                .droppedCount(records.size() - lines.size())
                .groupStats(new ArrayList<>(groups.values()))
                .groupsByKey(groups)
                .issues(issues)
                .proxyAudits(proxyAudits)
                .denials(denials)
                .unpaidPatients(unpaidPatients)
                .totals(totals)
                .build();
    }

    private GroupStat resolveGroup(GroupKey key, List<CanonicalLine> lines,
                                   AnalysisSettings settings, Map<String, Double> overrides) {
        GroupStat stat = aggregator.describe(key, lines, settings);
        ProxyResolution resolution = proxyResolver.resolve(key, lines, settings, overrides);
        stat.setProxy(resolution.value());
        stat.setMethod(resolution.method());
        stat.setEqualChargesCount(resolution.equalChargesCount());
        stat.setUsedDecontaminate(resolution.decontaminated());
        return stat;
    }

    private <T> List<T> runAudit(AuditDetector<T> detector, AuditContext context) {
        Span span = tracer.nextSpan()
                .name("benchmark.audit." + detector.getName())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<T> findings = detector.detect(context);
            span.tag("audit.findings", String.valueOf(findings.size()));
            return findings;
        } catch (Exception e) {
            span.error(e);
            log.error("Audit {} failed: {}", detector.getName(), e.getMessage(), e);
            // One failing audit must not drop the classification results
            return new ArrayList<>();
        } finally {
            span.end();
        }
    }

    private static BenchmarkTotals totals(List<CanonicalLine> lines, Iterable<GroupStat> groups,
                                          AnalysisSettings settings) {
        double insurancePaid = 0;
        double actual = 0;
        for (CanonicalLine line : lines) {
            insurancePaid += line.insurancePaid();
            actual += settings.metricOf(line);
        }
        double expected = 0;
        for (GroupStat group : groups) {
            expected += group.getProxy() * group.getN();
        }
        return BenchmarkTotals.builder()
                .totalInsurancePaid(Amounts.round2(insurancePaid))
                .totalActual(Amounts.round2(actual))
                .totalExpected(Amounts.round2(expected))
                .deltaExpectedMinusActual(Amounts.round2(expected - actual))
                .benchmarkLabel(settings.benchmark().getLabel())
                .build();
    }

    private <T> T inSpan(String name, Supplier<T> stage) {
        Span span = tracer.nextSpan().name(name).start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return stage.get();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
