package com.billing.benchmark.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One input row as header → raw cell text. Field lookups tolerate header spelling
 * variations: "Patient Name", "patient_name" and "PATIENT-NAME" all resolve to the same field.
 */
public final class RawRecord {

    private final Map<String, String> values;

    private RawRecord(Map<String, String> values) {
        this.values = values;
    }

    public static RawRecord of(Map<String, ?> source) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((header, value) -> {
                if (header != null) {
                    copy.put(header, value == null ? null : value.toString());
                }
            });
        }
        return new RawRecord(Collections.unmodifiableMap(copy));
    }

    /**
     * Canonical form of a header: trimmed, whitespace runs replaced by "_",
     * anything outside [A-Za-z0-9_] removed, uppercased.
     */
    public static String canonicalHeader(String header) {
        if (header == null) return "";
        return header.trim()
                .replaceAll("\\s+", "_")
                .replaceAll("[^A-Za-z0-9_]", "")
                .toUpperCase();
    }

    /**
     * Returns the raw value for a field, or null when no header matches.
     */
    public String get(String field) {
        if (values.containsKey(field)) {
            return values.get(field);
        }
        String wanted = canonicalHeader(field);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (canonicalHeader(entry.getKey()).equals(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * First non-blank value among the given field names, or null.
     */
    public String firstNonBlank(String... fields) {
        for (String field : fields) {
            String value = get(field);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawRecord other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RawRecord" + values;
    }
}
