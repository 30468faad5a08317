package com.vidnyan.rva.adapter.out.report;

import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase.AnalysisResult;
import com.vidnyan.rva.domain.finding.Finding;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.List;

/**
 * Report Model - final output of the analysis.
 * Contains findings ordered by location with summary statistics.
 */
@Value
@Builder
public class ReportModel {
    String sourcePath;
    Summary summary;
    List<Finding> findings;

    @Value
    @Builder
    public static class Summary {
        int filesAnalyzed;
        int filesFailed;
        int unitsChecked;
        int unitsSkipped;
        int componentsChecked;
        int totalFindings;
        long nestedFindings;
        long durationMs;
    }

    /**
     * Build report from an analysis result.
     */
    public static ReportModel build(String sourcePath, AnalysisResult result) {
        List<Finding> sorted = result.findings().stream()
                .sorted(Comparator
                        .comparing((Finding f) -> f.location().filePath())
                        .thenComparingInt(f -> f.location().line())
                        .thenComparingInt(f -> f.location().column()))
                .toList();

        Summary summary = Summary.builder()
                .filesAnalyzed(result.stats().filesAnalyzed())
                .filesFailed(result.stats().filesFailed())
                .unitsChecked(result.stats().unitsChecked())
                .unitsSkipped(result.stats().unitsSkipped())
                .componentsChecked(result.stats().componentsChecked())
                .totalFindings(sorted.size())
                .nestedFindings(result.nestedCount())
                .durationMs(result.stats().totalDurationMs())
                .build();

        return ReportModel.builder()
                .sourcePath(sourcePath)
                .summary(summary)
                .findings(sorted)
                .build();
    }
}
