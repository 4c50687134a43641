package com.billing.benchmark.controller;

import com.billing.benchmark.model.AnalysisSummary;
import com.billing.benchmark.model.GroupDescriptor;
import com.billing.benchmark.model.GroupKey;
import com.billing.benchmark.model.OverrideRequest;
import com.billing.benchmark.service.OverrideService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/overrides")
@Tag(name = "Overrides", description = "Manual proxy values per group; every change recomputes the analysis")
public class OverrideController {

    private final OverrideService overrideService;

    public OverrideController(OverrideService overrideService) {
        this.overrideService = overrideService;
    }

    @GetMapping
    @Operation(summary = "List overrides", description = "Group key label → proxy amount")
    public ResponseEntity<Map<String, Double>> list() {
        return ResponseEntity.ok(overrideService.findAll());
    }

    @PutMapping
    @Operation(summary = "Set an override",
               description = "Payer, CPT and POS are required; units only count when units are part of the key")
    public ResponseEntity<?> apply(@RequestBody OverrideRequest request) {
        try {
            return ResponseEntity.ok(AnalysisSummary.of(overrideService.apply(request)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/clear")
    @Operation(summary = "Clear the override of one group")
    public ResponseEntity<?> clear(@RequestBody GroupDescriptor group) {
        try {
            return ResponseEntity.ok(AnalysisSummary.of(overrideService.clear(group)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping
    @Operation(summary = "Clear all overrides")
    public ResponseEntity<AnalysisSummary> clearAll() {
        return ResponseEntity.ok(AnalysisSummary.of(overrideService.clearAll()));
    }

    @PostMapping("/key")
    @Operation(summary = "Preview the group key a descriptor maps to under the active key variant")
    public ResponseEntity<?> previewKey(@RequestBody GroupDescriptor group) {
        try {
            GroupKey key = overrideService.keyFor(group);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("key", key.label());
            body.put("includesUnits", key.includesUnits());
            body.put("currentOverride", overrideService.findAll().get(key.label()));
            return ResponseEntity.ok(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
