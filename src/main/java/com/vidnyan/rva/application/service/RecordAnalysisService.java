package com.vidnyan.rva.application.service;

import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase;
import com.vidnyan.rva.application.port.out.RecordSource;
import com.vidnyan.rva.domain.finding.Finding;
import com.vidnyan.rva.domain.finding.RecordUnit;
import com.vidnyan.rva.domain.finding.RecordValueChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecordAnalysisService implements AnalyzeRecordsUseCase {

    private final RecordSource recordSource;
    private final RecordValueChecker checker;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting analysis of: {}", request.sourcePath());

        // Step 1: Extract derived-equality types
        log.info("Step 1: Parsing source code...");
        RecordSource.ParsingResult parsingResult = recordSource.parse(
                request.sourcePath(),
                new RecordSource.ParsingOptions(
                        request.includeTests(),
                        request.includeAnnotatedClasses(),
                        request.excludePatterns()
                )
        );
        log.info("Extracted {} records and {} annotated classes",
                parsingResult.stats().recordsExtracted(),
                parsingResult.stats().classesExtracted());

        // Step 2: Classify every component
        log.info("Step 2: Checking components...");
        List<Finding> findings = new ArrayList<>();
        int checked = 0;
        int skipped = 0;
        int components = 0;
        for (RecordUnit unit : parsingResult.units()) {
            if (checker.declaresOwnEquality(unit)) {
                skipped++;
                log.debug("  {} declares its own equals, skipped", unit.qualifiedName());
                continue;
            }
            checked++;
            components += unit.components().size();
            List<Finding> unitFindings = checker.check(unit);
            if (!unitFindings.isEmpty()) {
                log.info("  {}: {} findings", unit.qualifiedName(), unitFindings.size());
            }
            findings.addAll(unitFindings);
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                parsingResult.stats().filesProcessed(),
                parsingResult.stats().filesFailed(),
                checked,
                skipped,
                components,
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} findings in {}ms", findings.size(), stats.totalDurationMs());
        return new AnalysisResult(List.copyOf(findings), stats);
    }
}
