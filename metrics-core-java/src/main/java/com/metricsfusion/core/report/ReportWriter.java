package com.metricsfusion.core.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a finished report to {@code outputDir/report.json}.
 * Child order and metric order are taken from the tree as-is, so identical input yields
 * identical output apart from {@code generatedAt}.
 */
public class ReportWriter {

    public static final String REPORT_FILE = "report.json";

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg) { super(msg); }
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * @param report    report to write
     * @param outputDir directory to write into (created if absent)
     * @return path of the written file
     */
    public Path write(ReportModel.Report report, Path outputDir) {
        if (report == null || report.solution == null) {
            throw new ReportWriteException("Report has no solution node");
        }
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }

        Path reportPath = outputDir.resolve(REPORT_FILE);
        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            ReportJson.gson().toJson(report, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + REPORT_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[metrics-fusion] " + REPORT_FILE + " written: " + reportPath);
        return reportPath;
    }
}
