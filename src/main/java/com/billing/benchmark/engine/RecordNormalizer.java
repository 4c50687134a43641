package com.billing.benchmark.engine;

import com.billing.benchmark.model.CanonicalLine;
import com.billing.benchmark.model.RawRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns raw export rows into canonical lines.
 *
 * allowed = |insurance payment| + max(0, patient payment) + max(0, balance), rounded to cents.
 * Rows with a blank CPT are dropped.
 */
@Component
public class RecordNormalizer {

    public static final String NO_MODIFIERS = "—";
    public static final String DEFAULT_UNITS = "1";

    static final String FIELD_PAYER = "Insurance";
    static final String FIELD_CPT = "CPT";
    static final String FIELD_POS = "POS";
    static final String FIELD_MODIFIERS = "Modifiers";
    static final String[] FIELD_UNITS = {"Days_or_Units", "Days_Or_Units", "Units"};
    static final String FIELD_PATIENT = "Patient_Name";
    static final String FIELD_DOS = "Date_of_Service";
    static final String FIELD_CHARGES = "Charges";
    static final String FIELD_INSURANCE_PAYMENT = "Insurance_Payment";
    static final String FIELD_PATIENT_PAYMENT = "Patient_Payment";
    static final String FIELD_BALANCE = "Balance";
    static final String FIELD_ADJUSTMENT = "Adjustment";

    private final PayerNormalizer payerNormalizer;

    public RecordNormalizer(PayerNormalizer payerNormalizer) {
        this.payerNormalizer = payerNormalizer;
    }

    /**
     * Normalizes all records, dropping those without a procedure code.
     * Surviving lines are indexed in arrival order.
     */
    public List<CanonicalLine> normalizeAll(List<RawRecord> records) {
        List<CanonicalLine> lines = new ArrayList<>(records.size());
        for (RawRecord record : records) {
            normalize(record, lines.size()).ifPresent(lines::add);
        }
        return lines;
    }

    public Optional<CanonicalLine> normalize(RawRecord record, int index) {
        String cpt = trimmed(record.get(FIELD_CPT));
        if (cpt.isEmpty()) {
            return Optional.empty();
        }

        double insurancePaid = Math.abs(Amounts.parse(record.get(FIELD_INSURANCE_PAYMENT)));
        double patientPaid = Math.max(0, Amounts.parse(record.get(FIELD_PATIENT_PAYMENT)));
        double balance = Math.max(0, Amounts.parse(record.get(FIELD_BALANCE)));

        return Optional.of(CanonicalLine.builder()
                .index(index)
                .payer(payerNormalizer.normalize(record.get(FIELD_PAYER)))
                .procedureCode(cpt)
                .placeOfService(trimmed(record.get(FIELD_POS)))
                .modifiers(normalizeModifiers(record.get(FIELD_MODIFIERS)))
                .units(normalizeUnits(record.firstNonBlank(FIELD_UNITS)))
                .patient(trimmed(record.get(FIELD_PATIENT)))
                .serviceDate(trimmed(record.get(FIELD_DOS)))
                .charges(Math.max(0, Amounts.parse(record.get(FIELD_CHARGES))))
                .insurancePaid(insurancePaid)
                .patientPaid(patientPaid)
                .balance(balance)
                .allowed(Amounts.round2(insurancePaid + patientPaid + balance))
                .adjustment(Amounts.parse(record.get(FIELD_ADJUSTMENT)))
                .build());
    }

    /**
     * Uppercased, de-duplicated, sorted modifier tokens joined with "+".
     * Accepts comma, whitespace or "+" separated input; an empty set renders as {@link #NO_MODIFIERS}.
     */
    public static String normalizeModifiers(String raw) {
        if (raw == null || raw.isBlank()) {
            return NO_MODIFIERS;
        }
        TreeSet<String> tokens = Arrays.stream(raw.split("[,\\s+]+"))
                .map(t -> t.trim().toUpperCase(Locale.ROOT))
                .filter(t -> !t.isEmpty() && !NO_MODIFIERS.equals(t))
                .collect(Collectors.toCollection(TreeSet::new));
        return tokens.isEmpty() ? NO_MODIFIERS : String.join("+", tokens);
    }

    public static String normalizeUnits(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_UNITS;
        }
        return raw.trim();
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
