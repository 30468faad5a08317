package com.vidnyan.rva.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.rva.adapter.out.report.JsonReportWriter;
import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase;
import com.vidnyan.rva.config.AnalysisProperties;
import com.vidnyan.rva.domain.finding.Finding;
import com.vidnyan.rva.domain.finding.RecordUnit;
import com.vidnyan.rva.domain.model.Location;
import com.vidnyan.rva.domain.semantics.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisCliRunnerTest {

    @TempDir
    Path tempDir;

    private final List<AnalyzeRecordsUseCase.AnalysisRequest> requests = new ArrayList<>();
    private final AnalysisProperties properties = new AnalysisProperties();

    @Test
    void run_ShouldPreferArgumentOverConfiguredPath() {
        properties.setSourcePath("configured");
        AnalysisCliRunner runner = runner(List.of());

        runner.run(arguments("from-args"));

        assertEquals(1, requests.size());
        assertEquals(Path.of("from-args"), requests.get(0).sourcePath());
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void run_ShouldTakePathAfterSpringOptions() {
        AnalysisCliRunner runner = runner(List.of());

        runner.run(arguments("--rva.analysis.fail-on-findings=true", "/src/main/java"));

        assertEquals(1, requests.size());
        assertEquals(Path.of("/src/main/java"), requests.get(0).sourcePath());
    }

    @Test
    void run_ShouldFallBackToConfiguredPathWhenOnlyOptionsAreGiven() {
        properties.setSourcePath("configured");
        AnalysisCliRunner runner = runner(List.of());

        runner.run(arguments("--rva.analysis.report-path=out.json"));

        assertEquals(Path.of("configured"), requests.get(0).sourcePath());
    }

    @Test
    void run_ShouldSkipWithoutSourcePathOrWhenDisabled() {
        AnalysisCliRunner runner = runner(List.of());
        runner.run(arguments());

        properties.setEnabled(false);
        properties.setSourcePath("configured");
        runner.run(arguments());

        assertTrue(requests.isEmpty());
    }

    @Test
    void run_ShouldWriteReportAndFailOnFindings() {
        // Arrange
        Path report = tempDir.resolve("out/report.json");
        properties.setSourcePath("src");
        properties.setReportPath(report.toString());
        properties.setFailOnFindings(true);
        Finding finding = Finding.of("com.example.Order",
                new RecordUnit.Component("payload", null, "byte[]", Location.at("Order.java", 3, 5)),
                Verdict.failed());
        AnalysisCliRunner runner = runner(List.of(finding));

        // Act
        runner.run(arguments());

        // Assert
        assertTrue(Files.exists(report));
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void run_ShouldKeepZeroExitCodeWhenFindingsAreTolerated() {
        properties.setSourcePath("src");
        Finding finding = Finding.of("com.example.Order",
                new RecordUnit.Component("owner", null, "java.lang.Object", Location.at("Order.java", 3, 5)),
                Verdict.failed());
        AnalysisCliRunner runner = runner(List.of(finding));

        runner.run(arguments());

        assertEquals(0, runner.getExitCode());
    }

    private AnalysisCliRunner runner(List<Finding> findings) {
        AnalyzeRecordsUseCase useCase = request -> {
            requests.add(request);
            return new AnalyzeRecordsUseCase.AnalysisResult(findings,
                    new AnalyzeRecordsUseCase.AnalysisStats(1, 0, 1, 0, 1, 5));
        };
        return new AnalysisCliRunner(useCase, new JsonReportWriter(new ObjectMapper()), properties);
    }

    private static DefaultApplicationArguments arguments(String... args) {
        return new DefaultApplicationArguments(args);
    }
}
