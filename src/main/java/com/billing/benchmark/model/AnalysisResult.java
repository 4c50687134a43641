package com.billing.benchmark.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one recompute produces. Replaced wholesale on the next recompute.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    private AnalysisSettings settings;

    private int recordCount;

    // Records dropped because their procedure code was blank
    private int droppedCount;

    @Builder.Default
    private List<GroupStat> groupStats = new ArrayList<>();

    @Builder.Default
    private List<Issue> issues = new ArrayList<>();

    @Builder.Default
    private List<ProxyAuditEntry> proxyAudits = new ArrayList<>();

    @Builder.Default
    private List<DenialEntry> denials = new ArrayList<>();

    @Builder.Default
    private List<PatientAggregate> unpaidPatients = new ArrayList<>();

    private BenchmarkTotals totals;

    @JsonIgnore
    @Builder.Default
    private Map<GroupKey, GroupStat> groupsByKey = new LinkedHashMap<>();

    public static AnalysisResult empty(AnalysisSettings settings) {
        return AnalysisResult.builder()
                .settings(settings)
                .totals(BenchmarkTotals.empty(settings.benchmark()))
                .build();
    }

    public int getLineCount() {
        return issues.size();
    }

    public Optional<GroupStat> findGroup(GroupKey key) {
        return Optional.ofNullable(groupsByKey.get(key));
    }

    public long countByStatus(PaymentStatus status) {
        return issues.stream().filter(i -> i.getStatus() == status).count();
    }

    public long countOverridden() {
        return groupStats.stream().filter(g -> g.getMethod() == ProxyMethod.OVERRIDE).count();
    }
}
