package com.billing.benchmark.service;

import com.billing.benchmark.model.Issue;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Renders issues as CSV for spreadsheet review.
 */
@Service
public class IssueExportService {

    static final String[] HEADERS = {
            "Patient", "DOS", "Insurance", "CPT", "POS", "Modifiers", "Units", "Charges",
            "Metric", "Proxy", "ProxyDerivation", "DeviationPct", "Status", "Explanation"
    };

    public String toCsv(List<Issue> issues) {
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADERS).build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (Issue issue : issues) {
                printer.printRecord(
                        issue.getPatient(),
                        issue.getServiceDate(),
                        issue.getPayer(),
                        issue.getProcedureCode(),
                        issue.getPlaceOfService(),
                        issue.getModifiers(),
                        issue.getUnits(),
                        amount(issue.getCharges()),
                        amount(issue.getMetric()),
                        amount(issue.getProxy()),
                        issue.getDerivation() == null ? "" : issue.getDerivation().getSummary(),
                        String.format(Locale.US, "%.1f%%", issue.getDeviationPct()),
                        issue.getStatusLabel(),
                        issue.getExplanation());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private static String amount(double value) {
        return String.format(Locale.US, "%.2f", value);
    }
}
