package com.billing.benchmark.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Headline numbers of the last recompute")
public class AnalysisSummary {

    @Schema(description = "Rows received", example = "1250")
    private int recordCount;

    @Schema(description = "Rows dropped for a blank procedure code", example = "3")
    private int droppedCount;

    @Schema(description = "Lines analysed", example = "1247")
    private int lineCount;

    @Schema(description = "Benchmark groups", example = "184")
    private int groupCount;

    private long withinRangeCount;

    private long underpaidCount;

    private long overpaidCount;

    private int proxyAuditCount;

    private int denialCount;

    private int unpaidPatientCount;

    @Schema(description = "Groups whose proxy came from a manual override", example = "2")
    private long overriddenGroupCount;

    private AnalysisSettings settings;

    private BenchmarkTotals totals;

    public static AnalysisSummary of(AnalysisResult result) {
        return AnalysisSummary.builder()
                .recordCount(result.getRecordCount())
                .droppedCount(result.getDroppedCount())
                .lineCount(result.getLineCount())
                .groupCount(result.getGroupStats().size())
                .withinRangeCount(result.countByStatus(PaymentStatus.WITHIN_RANGE))
                .underpaidCount(result.countByStatus(PaymentStatus.UNDERPAID))
                .overpaidCount(result.countByStatus(PaymentStatus.OVERPAID))
                .proxyAuditCount(result.getProxyAudits().size())
                .denialCount(result.getDenials().size())
                .unpaidPatientCount(result.getUnpaidPatients().size())
                .overriddenGroupCount(result.countOverridden())
                .settings(result.getSettings())
                .totals(result.getTotals())
                .build();
    }
}
