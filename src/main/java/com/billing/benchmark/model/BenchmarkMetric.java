package com.billing.benchmark.model;

/**
 * The per-line amount that is benchmarked against the group proxy.
 */
public enum BenchmarkMetric {
    PAID("Paid"),
    ALLOWED("Allowed");

    private final String label;

    BenchmarkMetric(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public double valueOf(CanonicalLine line) {
        return this == PAID ? line.insurancePaid() : line.allowed();
    }
}
