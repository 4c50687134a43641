package com.billing.benchmark.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a group's proxy value was derived.
 */
public enum ProxyMethod {
    MAX_WHEN_FEW("max_when_few"),
    MODE("mode"),
    MODE_TIE_MAX("mode (tie→max)"),
    OVERRIDE("override");

    private final String label;

    ProxyMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
