package com.billing.benchmark.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI paymentBenchmarkOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Payment Benchmark API")
                        .version("1.0.0")
                        .description(
                                "Benchmarks insurer payments per payer × CPT × POS × modifiers (optionally × units) " +
                                "and flags lines that deviate from the group's typical value.\n\n" +
                                "**Analysis Pipeline:**\n" +
                                "1. Load billing rows via `POST /analysis/rows`, `/analysis/import` or `/analysis/upload`\n" +
                                "2. Normalize each row (payer aliases, modifiers, allowed = ins + pat + bal)\n" +
                                "3. Group lines and compute distribution statistics per group\n" +
                                "4. Resolve the proxy: **max** when n ≤ 2, otherwise **mode** (tie → higher $); overrides win\n" +
                                "5. Classify each line against the proxy with a ±threshold (default 10%)\n" +
                                "6. Run audits: low-confidence proxies, denials, patients with $0 insurer payment\n\n" +
                                "Every change to rows, settings or overrides triggers a full recompute.")
                        .contact(new Contact().name("Revenue Integrity Team")));
    }
}
