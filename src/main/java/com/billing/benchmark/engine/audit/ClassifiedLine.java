package com.billing.benchmark.engine.audit;

import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.GroupStat;
import com.billing.benchmark.model.Issue;

public record ClassifiedLine(CanonicalLine line, GroupStat group, Issue issue) {
}
