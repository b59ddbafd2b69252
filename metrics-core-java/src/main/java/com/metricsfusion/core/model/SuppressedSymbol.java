package com.metricsfusion.core.model;

/**
 * Entry of the suppression list produced by scanning source code for suppression attributes.
 *
 * @param fullyQualifiedName symbol the suppression applies to
 * @param metric             metric id or alias (nullable; derived from {@code ruleId} when absent)
 * @param ruleId             analyzer rule id such as {@code CA1502} (nullable)
 * @param justification      free text (nullable)
 * @param filePath           file the suppression was found in (nullable)
 */
public record SuppressedSymbol(
        String fullyQualifiedName,
        String metric,
        String ruleId,
        String justification,
        String filePath
) {}
