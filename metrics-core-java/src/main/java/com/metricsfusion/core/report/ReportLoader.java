package com.metricsfusion.core.report;

import com.google.gson.JsonParseException;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.NodeKind;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a report written by {@link ReportWriter}, typically the baseline of a later run.
 */
public class ReportLoader {

    /**
     * @throws ReportLoadException if the file is missing, malformed or has no solution node
     */
    public ReportModel.Report load(Path reportPath) {
        if (!Files.exists(reportPath)) {
            throw new ReportLoadException("Report file not found: " + reportPath);
        }
        ReportModel.Report report;
        try (Reader reader = Files.newBufferedReader(reportPath, StandardCharsets.UTF_8)) {
            report = ReportJson.gson().fromJson(reader, ReportModel.Report.class);
        } catch (JsonParseException e) {
            throw new ReportLoadException("Report file is not valid JSON: " + reportPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ReportLoadException("Failed to read report: " + reportPath + ": " + e.getMessage(), e);
        }
        if (report == null || report.solution == null) {
            throw new ReportLoadException("Report file has no solution node: " + reportPath);
        }
        if (report.solution.kind() != NodeKind.SOLUTION) {
            throw new ReportLoadException("Report root is a " + report.solution.kind().label()
                    + " node, expected Solution: " + reportPath);
        }
        return report;
    }

    /** Solution tree of the report at {@code reportPath}. */
    public MetricsNode loadBaseline(Path reportPath) {
        return load(reportPath).solution;
    }

    public static class ReportLoadException extends RuntimeException {
        public ReportLoadException(String message) { super(message); }
        public ReportLoadException(String message, Throwable cause) { super(message, cause); }
    }
}
