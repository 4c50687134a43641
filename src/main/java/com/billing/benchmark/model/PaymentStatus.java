package com.billing.benchmark.model;

public enum PaymentStatus {
    WITHIN_RANGE,
    UNDERPAID,
    OVERPAID;

    public String label(BenchmarkMetric benchmark) {
        return switch (this) {
            case WITHIN_RANGE -> "Within expected range";
            case UNDERPAID -> benchmark == BenchmarkMetric.PAID ? "Underpaid" : "Underpayment";
            case OVERPAID -> benchmark == BenchmarkMetric.PAID ? "Overpaid" : "Overpayment";
        };
    }

    public boolean isFlagged() {
        return this != WITHIN_RANGE;
    }
}
