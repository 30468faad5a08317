package com.vidnyan.rva.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the analysis run.
 * Can be configured via application.properties or application.yml
 */
@Data
@ConfigurationProperties(prefix = "rva.analysis")
public class AnalysisProperties {

    /**
     * Run the analysis on startup.
     */
    private boolean enabled = true;

    /**
     * Path to the sources to analyze. Empty: take it from the first argument.
     */
    private String sourcePath = "";

    private boolean includeTests = false;

    /**
     * Also check classes carrying a derived-equality annotation.
     */
    private boolean includeAnnotatedClasses = true;

    /**
     * Path fragments to skip.
     */
    private List<String> excludePatterns = new ArrayList<>();

    /**
     * Where to write the JSON report. Empty: no report file.
     */
    private String reportPath = "";

    /**
     * Exit with status 1 when findings are reported.
     */
    private boolean failOnFindings = false;
}
