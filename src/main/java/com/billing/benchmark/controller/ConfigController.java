package com.billing.benchmark.controller;

import com.billing.benchmark.config.BenchmarkConfig;
import com.billing.benchmark.model.BenchmarkMetric;
import com.billing.benchmark.service.AnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify analysis settings (threshold, benchmark, key variant)")
public class ConfigController {

    private final BenchmarkConfig config;
    private final AnalysisService analysisService;

    public ConfigController(BenchmarkConfig config, AnalysisService analysisService) {
        this.config = config;
        this.analysisService = analysisService;
    }

    @Operation(summary = "Get analysis settings")
    @GetMapping("/settings")
    public ResponseEntity<Map<String, Object>> getSettings() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("thresholdPct", config.getThresholdPct());
        body.put("minThresholdPct", config.getMinThresholdPct());
        body.put("maxThresholdPct", config.getMaxThresholdPct());
        body.put("benchmark", config.getBenchmark());
        body.put("decontaminateChargesProxy", config.isDecontaminateChargesProxy());
        body.put("includeUnitsInKey", config.isIncludeUnitsInKey());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update analysis settings",
            description = "Omitted fields keep their value. Triggers a recompute. Changes reset on restart.")
    @PutMapping("/settings")
    public ResponseEntity<?> updateSettings(@RequestBody Map<String, Object> body) {
        double threshold = toDouble(body, "thresholdPct", config.getThresholdPct());
        if (!(threshold >= config.getMinThresholdPct() && threshold <= config.getMaxThresholdPct())) {
            return badRequest(String.format(Locale.US, "thresholdPct must be between %.0f and %.0f",
                    config.getMinThresholdPct(), config.getMaxThresholdPct()), "thresholdPct");
        }

        BenchmarkMetric benchmark = config.getBenchmark();
        Object rawBenchmark = body.get("benchmark");
        if (rawBenchmark != null) {
            try {
                benchmark = BenchmarkMetric.valueOf(rawBenchmark.toString().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return badRequest("benchmark must be PAID or ALLOWED", "benchmark");
            }
        }

        Boolean decontaminate = toBoolean(body, "decontaminateChargesProxy", config.isDecontaminateChargesProxy());
        if (decontaminate == null) return badRequest("decontaminateChargesProxy must be true or false", "decontaminateChargesProxy");
        Boolean includeUnits = toBoolean(body, "includeUnitsInKey", config.isIncludeUnitsInKey());
        if (includeUnits == null) return badRequest("includeUnitsInKey must be true or false", "includeUnitsInKey");

        analysisService.updateSettings(threshold, benchmark, decontaminate, includeUnits);
        return getSettings();
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return Double.NaN; }
    }

    private Boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        String s = v.toString().trim();
        if (s.equalsIgnoreCase("true")) return true;
        if (s.equalsIgnoreCase("false")) return false;
        return null;
    }
}
