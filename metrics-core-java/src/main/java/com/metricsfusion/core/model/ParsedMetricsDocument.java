package com.metricsfusion.core.model;

import java.util.List;
import java.util.Map;

/**
 * Output of one format parser for one input file.
 *
 * @param solutionName     solution the report was produced for (nullable)
 * @param sourcePath       file the document was read from, used in error messages (nullable)
 * @param source           tool family of the report
 * @param elements         flat element list in the order the parser produced it
 * @param ruleDescriptions rule id to description, for finding documents (nullable)
 */
public record ParsedMetricsDocument(
        String solutionName,
        String sourcePath,
        DocumentSource source,
        List<ParsedCodeElement> elements,
        Map<String, RuleDescription> ruleDescriptions
) {

    public ParsedMetricsDocument(String solutionName, String sourcePath, DocumentSource source,
                                 List<ParsedCodeElement> elements) {
        this(solutionName, sourcePath, source, elements, null);
    }

    public Map<String, RuleDescription> getRuleDescriptions() {
        return ruleDescriptions != null ? ruleDescriptions : Map.of();
    }

    public ParsedMetricsDocument withSource(DocumentSource documentSource) {
        return new ParsedMetricsDocument(solutionName, sourcePath, documentSource, elements, ruleDescriptions);
    }

    public ParsedMetricsDocument withSourcePath(String path) {
        return new ParsedMetricsDocument(solutionName, path, source, elements, ruleDescriptions);
    }
}
