package com.billing.benchmark.engine.audit;

import java.util.List;

/**
 * Strategy interface for post-classification audits.
 * Each implementation scans the classified lines of one recompute for a single kind of finding.
 */
public interface AuditDetector<T> {

    /**
     * Short name used for tracing and logging.
     */
    String getName();

    /**
     * Scans the recompute and returns findings in the detector's output order.
     */
    List<T> detect(AuditContext context);
}
