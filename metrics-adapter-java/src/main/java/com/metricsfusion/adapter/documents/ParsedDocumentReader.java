package com.metricsfusion.adapter.documents;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.ParsedCodeElement;
import com.metricsfusion.core.model.ParsedMetricsDocument;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads parsed-document JSON files produced by the format parsers.
 * Files are read in parallel; the result keeps the order of the input paths.
 */
public class ParsedDocumentReader {

    private static final Gson GSON = new Gson();

    public List<ParsedMetricsDocument> readAll(List<Path> paths) {
        return paths.parallelStream()
                .map(this::read)
                .collect(Collectors.toList());
    }

    /**
     * @throws DocumentReadException if the file is missing or is not a document object
     */
    public ParsedMetricsDocument read(Path path) {
        if (!Files.exists(path)) {
            throw new DocumentReadException("Document file not found: " + path);
        }
        DocumentJson.Document json;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            json = GSON.fromJson(reader, DocumentJson.Document.class);
        } catch (JsonParseException e) {
            throw new DocumentReadException("Document is not valid JSON: " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read document: " + path + ": " + e.getMessage(), e);
        }
        if (json == null) {
            throw new DocumentReadException("Document file is empty: " + path);
        }
        String sourcePath = json.sourcePath != null && !json.sourcePath.isBlank() ? json.sourcePath : path.toString();
        // a missing element list is left null; the aggregator rejects it with the document path
        List<ParsedCodeElement> elements = null;
        if (json.elements != null) {
            elements = new ArrayList<>(json.elements.size());
            for (DocumentJson.Element element : json.elements) {
                elements.add(element == null ? null : toElement(element, sourcePath));
            }
        }
        return new ParsedMetricsDocument(json.solutionName, sourcePath, json.source, elements, json.ruleDescriptions);
    }

    private static ParsedCodeElement toElement(DocumentJson.Element json, String sourcePath) {
        Map<MetricIdentifier, MetricValue> metrics = new EnumMap<>(MetricIdentifier.class);
        if (json.metrics != null) {
            json.metrics.forEach((id, value) -> {
                MetricIdentifier metric = MetricIdentifier.fromId(id).orElse(null);
                if (metric == null) {
                    System.err.println("[metrics-fusion] WARNING: unknown metric '" + id + "' ignored in " + sourcePath);
                    return;
                }
                if (value != null) {
                    value.unit = metric.unit();
                    metrics.put(metric, value);
                }
            });
        }
        return new ParsedCodeElement(json.kind, json.name, json.fullyQualifiedName, json.parentFullyQualifiedName,
                json.containingAssemblyName, json.memberKind, json.source, metrics, json.hasFindings);
    }

    public static class DocumentReadException extends RuntimeException {
        public DocumentReadException(String message) { super(message); }
        public DocumentReadException(String message, Throwable cause) { super(message, cause); }
    }
}
