package com.billing.benchmark.controller;

import com.billing.benchmark.model.GroupDescriptor;
import com.billing.benchmark.model.GroupLookupResult;
import com.billing.benchmark.service.GroupLookupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/lookup")
@Tag(name = "Lookup", description = "Explain the proxy of groups taken from older reports")
public class LookupController {

    private final GroupLookupService lookupService;

    public LookupController(GroupLookupService lookupService) {
        this.lookupService = lookupService;
    }

    @PostMapping
    @Operation(summary = "Look up groups in the last result",
               description = "Unknown groups come back with found=false and a hint instead of an error")
    public ResponseEntity<?> lookup(@RequestBody List<GroupDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "at least one group is required"));
        }
        List<GroupLookupResult> results = lookupService.lookup(descriptors);
        return ResponseEntity.ok(results);
    }
}
