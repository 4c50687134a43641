package com.billing.benchmark.engine;

import com.billing.benchmark.config.BenchmarkConfig;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Collapses payer spelling variants. Names containing a configured alias token map to
 * that alias' canonical name; everything else gets whitespace, hyphen and "Inc" cleanup.
 */
@Component
public class PayerNormalizer {

    private final BenchmarkConfig config;

    public PayerNormalizer(BenchmarkConfig config) {
        this.config = config;
    }

    public String normalize(String rawName) {
        String name = rawName == null ? "" : rawName.trim();
        String upper = name.toUpperCase(Locale.ROOT);

        for (BenchmarkConfig.PayerAlias alias : config.getPayerAliases()) {
            for (String token : alias.getTokens()) {
                if (!token.isBlank() && upper.contains(token.toUpperCase(Locale.ROOT))) {
                    return alias.getCanonicalName();
                }
            }
        }

        return name
                .replaceAll("\\s+", " ")
                .replaceAll("\\s+-\\s+", " - ")
                .replaceAll("(?i)\\s+INC$", "")
                .trim();
    }
}
