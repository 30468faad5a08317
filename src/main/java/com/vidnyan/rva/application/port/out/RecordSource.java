package com.vidnyan.rva.application.port.out;

import com.vidnyan.rva.domain.finding.RecordUnit;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for extracting derived-equality types from source code.
 * Implemented by adapters (e.g., JavaParser adapter).
 */
public interface RecordSource {

    /**
     * Parse source files and collect the records (and annotated classes) to check.
     * @param sourcePath Root directory of source files
     * @param options Parsing options
     * @return Units to check, with parsing statistics
     */
    ParsingResult parse(Path sourcePath, ParsingOptions options);

    /**
     * Parsing options.
     */
    record ParsingOptions(
        boolean includeTests,
        boolean includeAnnotatedClasses,
        List<String> excludePatterns
    ) {
        public static ParsingOptions defaults() {
            return new ParsingOptions(false, true, List.of());
        }
    }

    /**
     * Parsing result.
     */
    record ParsingResult(
        List<RecordUnit> units,
        ParsingStats stats
    ) {}

    /**
     * Parsing statistics.
     */
    record ParsingStats(
        int filesProcessed,
        int filesFailed,
        int recordsExtracted,
        int classesExtracted,
        long durationMs
    ) {
        public static ParsingStats empty() {
            return new ParsingStats(0, 0, 0, 0, 0);
        }
    }
}
