package com.billing.benchmark.service;

import com.billing.benchmark.model.RawRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses delimited billing exports (header row first) into raw records.
 * The delimiter is detected from the header line: tab, comma, semicolon or pipe.
 */
@Service
public class RowImportService {

    private static final Logger log = LoggerFactory.getLogger(RowImportService.class);

    private static final char[] CANDIDATE_DELIMITERS = {'\t', ',', ';', '|'};

    public List<RawRecord> parse(InputStream in) {
        try {
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read uploaded file", e);
        }
    }

    public List<RawRecord> parse(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String content = text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
        char delimiter = detectDelimiter(content);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .setAllowMissingColumnNames(true)
                .build();

        List<RawRecord> records = new ArrayList<>();
        try (CSVParser parser = format.parse(new StringReader(content))) {
            List<String> headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    values.putIfAbsent(headers.get(i), record.isSet(i) ? record.get(i) : null);
                }
                if (values.values().stream().allMatch(v -> v == null || v.isEmpty())) {
                    continue;
                }
                records.add(RawRecord.of(values));
            }
        } catch (IOException | IllegalStateException e) {
            throw new IllegalArgumentException("Unreadable delimited input: " + e.getMessage(), e);
        }

        log.debug("Parsed {} rows (delimiter '{}')", records.size(), delimiter == '\t' ? "\\t" : delimiter);
        return records;
    }

    /**
     * Most frequent candidate delimiter on the first non-blank line; tab wins ties.
     */
    static char detectDelimiter(String content) {
        String header = content.lines().filter(l -> !l.isBlank()).findFirst().orElse("");
        char best = CANDIDATE_DELIMITERS[0];
        long bestCount = -1;
        for (char candidate : CANDIDATE_DELIMITERS) {
            long count = header.chars().filter(c -> c == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return bestCount > 0 ? best : ',';
    }
}
