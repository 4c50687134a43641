package com.billing.benchmark.engine.audit;

import com.billing.benchmark.model.AnalysisSettings;
import com.billing.benchmark.model.CanonicalLine;

import java.util.List;

/**
 * Inputs shared by all audits of one recompute.
 *
 * @param lines      canonical lines in arrival order
 * @param classified lines paired with their group and issue, in group display order
 */
public record AuditContext(List<CanonicalLine> lines, List<ClassifiedLine> classified, AnalysisSettings settings) {
}
