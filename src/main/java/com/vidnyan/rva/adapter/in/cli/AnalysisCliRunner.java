package com.vidnyan.rva.adapter.in.cli;

import com.vidnyan.rva.adapter.out.report.JsonReportWriter;
import com.vidnyan.rva.adapter.out.report.ReportModel;
import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase;
import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase.AnalysisRequest;
import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase.AnalysisResult;
import com.vidnyan.rva.config.AnalysisProperties;
import com.vidnyan.rva.domain.finding.Finding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for standalone analysis.
 * Takes the source path from the first non-option argument or from rva.analysis.source-path;
 * {@code --name=value} options are left to Spring's property binding.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final int MAX_PRINTED = 100;

    private final AnalyzeRecordsUseCase analyzeRecordsUseCase;
    private final JsonReportWriter reportWriter;
    private final AnalysisProperties properties;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isEnabled()) {
            log.info("Analysis is disabled. Set rva.analysis.enabled=true to run.");
            return;
        }

        List<String> positional = args.getNonOptionArgs();
        String sourcePath = !positional.isEmpty() && !positional.get(0).isBlank()
                ? positional.get(0)
                : properties.getSourcePath();
        if (sourcePath == null || sourcePath.isBlank()) {
            printUsage();
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           RVA - Record Value Analyzer                         ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        AnalysisRequest request = new AnalysisRequest(
                Path.of(sourcePath),
                properties.isIncludeTests(),
                properties.isIncludeAnnotatedClasses(),
                properties.getExcludePatterns());
        AnalysisResult result = analyzeRecordsUseCase.analyze(request);

        printResults(result);
        writeReport(sourcePath, result);

        if (properties.isFailOnFindings() && result.hasFindings()) {
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void writeReport(String sourcePath, AnalysisResult result) {
        String reportPath = properties.getReportPath();
        if (reportPath == null || reportPath.isBlank()) {
            return;
        }
        try {
            reportWriter.write(ReportModel.build(sourcePath, result), Path.of(reportPath));
        } catch (IOException e) {
            log.error("Failed to write report to {}", reportPath, e);
            exitCode = 2;
        }
    }

    private void printResults(AnalysisResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files analyzed:      {}", result.stats().filesAnalyzed());
        log.info(" Files failed:        {}", result.stats().filesFailed());
        log.info(" Types checked:       {}", result.stats().unitsChecked());
        log.info(" Types with equals:   {}", result.stats().unitsSkipped());
        log.info(" Members checked:     {}", result.stats().componentsChecked());
        log.info(" Duration:            {}ms", result.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        if (!result.hasFindings()) {
            log.info("");
            log.info("✅ Every member has value semantics.");
            return;
        }

        log.info(" FINDINGS: {} ({} through a nested member)", result.findings().size(), result.nestedCount());
        log.info("───────────────────────────────────────────────────────────────");

        int count = 0;
        for (Finding finding : result.findings()) {
            count++;
            if (count > MAX_PRINTED) {
                log.info(" ... and {} more findings", result.findings().size() - MAX_PRINTED);
                break;
            }
            log.warn(" [{}] {}: {}", finding.diagnosticId(), finding.location().format(), finding.message());
        }
    }

    private void printUsage() {
        log.info("");
        log.info("Usage: java -jar rva.jar [--rva.analysis.<option>=<value> ...] <source-path>");
        log.info("");
        log.info("Or configure in application.properties:");
        log.info("  rva.analysis.source-path=/path/to/src/main/java");
        log.info("  rva.analysis.report-path=target/rva-report.json");
        log.info("");
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen) {
            return path;
        }
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
