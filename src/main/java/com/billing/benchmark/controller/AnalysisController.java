package com.billing.benchmark.controller;

import com.billing.benchmark.model.AnalysisSummary;
import com.billing.benchmark.model.BenchmarkTotals;
import com.billing.benchmark.model.DenialEntry;
import com.billing.benchmark.model.GroupStat;
import com.billing.benchmark.model.Issue;
import com.billing.benchmark.model.PatientAggregate;
import com.billing.benchmark.model.ProxyAuditEntry;
import com.billing.benchmark.model.RawRecord;
import com.billing.benchmark.service.AnalysisService;
import com.billing.benchmark.service.IssueExportService;
import com.billing.benchmark.service.RowImportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Load billing rows and read benchmark results, audits and totals")
public class AnalysisController {

    private final AnalysisService analysisService;
    private final RowImportService rowImportService;
    private final IssueExportService issueExportService;

    public AnalysisController(AnalysisService analysisService,
                              RowImportService rowImportService,
                              IssueExportService issueExportService) {
        this.analysisService = analysisService;
        this.rowImportService = rowImportService;
        this.issueExportService = issueExportService;
    }

    // ── Loading ──

    @PostMapping("/rows")
    @Operation(summary = "Load billing rows as JSON",
               description = "Each row is a header → value object. Replaces the current rows and recomputes.")
    public ResponseEntity<?> loadRows(@RequestBody List<Map<String, Object>> rows) {
        if (rows == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "rows are required"));
        }
        List<RawRecord> records = rows.stream().map(RawRecord::of).toList();
        return ResponseEntity.ok(AnalysisSummary.of(analysisService.loadRows(records)));
    }

    @PostMapping(value = "/import", consumes = {MediaType.TEXT_PLAIN_VALUE, "text/csv"})
    @Operation(summary = "Import pasted delimited text",
               description = "Header row first; tab, comma, semicolon or pipe separated. Replaces the current rows.")
    public ResponseEntity<?> importText(@RequestBody String text) {
        try {
            return ResponseEntity.ok(AnalysisSummary.of(analysisService.loadRows(rowImportService.parse(text))));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a delimited export file", description = "Replaces the current rows and recomputes.")
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "file is empty", "field", "file"));
        }
        try {
            return ResponseEntity.ok(AnalysisSummary.of(
                    analysisService.loadRows(rowImportService.parse(file.getInputStream()))));
        } catch (IOException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @DeleteMapping
    @Operation(summary = "Reset", description = "Clears rows and results and returns to the paid benchmark")
    public ResponseEntity<AnalysisSummary> reset() {
        analysisService.reset();
        return ResponseEntity.ok(analysisService.getSummary());
    }

    // ── Results ──

    @GetMapping("/summary")
    @Operation(summary = "Headline counts, settings and totals of the last recompute")
    public ResponseEntity<AnalysisSummary> getSummary() {
        return ResponseEntity.ok(analysisService.getSummary());
    }

    @GetMapping("/groups")
    @Operation(summary = "Group statistics", description = "Sorted by payer, CPT, POS, modifiers")
    public ResponseEntity<List<GroupStat>> getGroups() {
        return ResponseEntity.ok(analysisService.getLastResult().getGroupStats());
    }

    @GetMapping("/issues")
    @Operation(summary = "Classified lines",
               description = "Flagged lines first, then by |deviation|. Filters: payer (substring), cpt, pos, mods.")
    public ResponseEntity<List<Issue>> getIssues(
            @RequestParam(required = false) String payer,
            @RequestParam(required = false) String cpt,
            @RequestParam(required = false) String pos,
            @RequestParam(required = false) String mods) {
        return ResponseEntity.ok(analysisService.findIssues(payer, cpt, pos, mods));
    }

    @GetMapping(value = "/issues/export", produces = "text/csv")
    @Operation(summary = "Export classified lines as CSV", description = "Accepts the same filters as /issues")
    public ResponseEntity<String> exportIssues(
            @RequestParam(required = false) String payer,
            @RequestParam(required = false) String cpt,
            @RequestParam(required = false) String pos,
            @RequestParam(required = false) String mods) {
        String csv = issueExportService.toCsv(analysisService.findIssues(payer, cpt, pos, mods));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"payment_issues.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @GetMapping("/proxy-audits")
    @Operation(summary = "Overpayments measured against a doubtful proxy")
    public ResponseEntity<List<ProxyAuditEntry>> getProxyAudits() {
        return ResponseEntity.ok(analysisService.getLastResult().getProxyAudits());
    }

    @GetMapping("/denials")
    @Operation(summary = "Fully written-off or zero-benchmark lines", description = "In arrival order")
    public ResponseEntity<List<DenialEntry>> getDenials() {
        return ResponseEntity.ok(analysisService.getLastResult().getDenials());
    }

    @GetMapping("/unpaid-patients")
    @Operation(summary = "Patients with charges but no insurer payment")
    public ResponseEntity<List<PatientAggregate>> getUnpaidPatients() {
        return ResponseEntity.ok(analysisService.getLastResult().getUnpaidPatients());
    }

    @GetMapping("/totals")
    @Operation(summary = "Portfolio totals: actual, expected and delta")
    public ResponseEntity<BenchmarkTotals> getTotals() {
        return ResponseEntity.ok(analysisService.getLastResult().getTotals());
    }
}
