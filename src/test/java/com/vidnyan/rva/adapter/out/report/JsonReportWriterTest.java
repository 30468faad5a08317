package com.vidnyan.rva.adapter.out.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase.AnalysisResult;
import com.vidnyan.rva.application.port.in.AnalyzeRecordsUseCase.AnalysisStats;
import com.vidnyan.rva.domain.finding.Finding;
import com.vidnyan.rva.domain.finding.RecordUnit;
import com.vidnyan.rva.domain.model.Location;
import com.vidnyan.rva.domain.semantics.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonReportWriter writer = new JsonReportWriter(objectMapper);

    @Test
    void build_ShouldOrderFindingsByLocation() {
        ReportModel report = ReportModel.build("src/main/java", sampleResult());

        assertEquals(List.of("buffer", "owner", "shipTo"),
                report.getFindings().stream().map(Finding::memberName).toList());
        assertEquals(3, report.getSummary().getTotalFindings());
        assertEquals(1, report.getSummary().getNestedFindings());
        assertEquals(4, report.getSummary().getUnitsChecked());
    }

    @Test
    void write_ShouldCreateParentDirectoriesAndWriteJson() throws IOException {
        // Arrange
        Path target = tempDir.resolve("reports/nested/rva.json");
        ReportModel report = ReportModel.build("src/main/java", sampleResult());

        // Act
        writer.write(report, target);

        // Assert
        assertTrue(Files.exists(target));
        JsonNode root = objectMapper.readTree(target.toFile());
        assertEquals("src/main/java", root.get("sourcePath").asText());
        assertEquals(3, root.get("summary").get("totalFindings").asInt());
        JsonNode first = root.get("findings").get(0);
        assertEquals("RVA01", first.get("diagnosticId").asText());
        assertEquals("Member 'int[] buffer' does not have value semantics", first.get("message").asText());
        assertEquals("FAILED", first.get("verdict").get("status").asText());
        assertEquals("A.java", first.get("location").get("filePath").asText());
    }

    @Test
    void toJson_ShouldIncludeNestedTypeName() throws IOException {
        String json = writer.toJson(ReportModel.build("src", sampleResult()));

        assertTrue(json.contains("\"innerTypeDisplayName\":\"java.lang.StringBuilder\""));
    }

    private static AnalysisResult sampleResult() {
        Finding shipTo = Finding.of("com.example.Order",
                component("shipTo", "com.example.Address", "B.java", 7),
                Verdict.nestedFailed("java.lang.StringBuilder"));
        Finding owner = Finding.of("com.example.Order",
                component("owner", "java.lang.Object", "B.java", 3),
                Verdict.failed());
        Finding buffer = Finding.of("com.example.Packet",
                component("buffer", "int[]", "A.java", 9),
                Verdict.failed());
        return new AnalysisResult(List.of(shipTo, owner, buffer), new AnalysisStats(2, 0, 4, 1, 9, 42));
    }

    private static RecordUnit.Component component(String name, String type, String file, int line) {
        return new RecordUnit.Component(name, null, type, Location.at(file, line, 5));
    }
}
