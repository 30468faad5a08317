package com.vidnyan.rva.application.port.in;

import com.vidnyan.rva.domain.finding.Finding;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: find members of derived-equality types that lack value semantics.
 */
public interface AnalyzeRecordsUseCase {

    /**
     * Analyze a codebase and return one finding per offending member.
     * @param request Analysis request parameters
     * @return Analysis result with findings and metadata
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        Path sourcePath,
        boolean includeTests,
        boolean includeAnnotatedClasses,
        List<String> excludePatterns
    ) {
        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(path, false, true, List.of());
        }
    }

    /**
     * Analysis result.
     */
    record AnalysisResult(
        List<Finding> findings,
        AnalysisStats stats
    ) {
        public boolean hasFindings() {
            return !findings.isEmpty();
        }

        public long nestedCount() {
            return findings.stream().filter(Finding::isNested).count();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int filesAnalyzed,
        int filesFailed,
        int unitsChecked,
        int unitsSkipped,
        int componentsChecked,
        long totalDurationMs
    ) {}
}
