package com.phillippitts.pingwatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for report, address list and trace transcript files.
 */
@Validated
@ConfigurationProperties(prefix = "pingwatch.export")
public class ExportProperties {

    /** Charset of every file written or read (the legacy desktop tool used windows-31j). */
    @NotBlank
    private String charset = "UTF-8";

    /** Default folder for monitoring reports when a request names only a file. */
    @NotBlank
    private String resultsDir = "Ping_Result";

    /** Default folder for trace transcripts. */
    @NotBlank
    private String traceDir = "Traceroute_Result";

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public String getResultsDir() {
        return resultsDir;
    }

    public void setResultsDir(String resultsDir) {
        this.resultsDir = resultsDir;
    }

    public String getTraceDir() {
        return traceDir;
    }

    public void setTraceDir(String traceDir) {
        this.traceDir = traceDir;
    }
}
