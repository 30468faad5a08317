package com.vidnyan.rva.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link ReportModel} as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public void write(ReportModel report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), report);
        log.info("Report written to {} ({} findings)", target, report.getSummary().getTotalFindings());
    }

    public String toJson(ReportModel report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }
}
