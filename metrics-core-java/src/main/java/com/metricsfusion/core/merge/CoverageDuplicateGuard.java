package com.metricsfusion.core.merge;

import com.metricsfusion.core.model.DocumentSource;
import com.metricsfusion.core.model.ElementKind;
import com.metricsfusion.core.model.ParsedCodeElement;
import com.metricsfusion.core.model.ParsedMetricsDocument;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejects coverage inputs that overlap. Coverage values are not additive, so two coverage
 * documents describing the same type or member would silently drop one of the readings.
 * Repeats inside a single document are fine.
 */
public class CoverageDuplicateGuard {

    /**
     * @throws DuplicateSymbolException naming the first FQN defined by two coverage documents
     */
    public void verify(List<ParsedMetricsDocument> documents) {
        Map<String, String> typeOrigins = new HashMap<>();
        Map<String, String> memberOrigins = new HashMap<>();

        int index = 0;
        for (ParsedMetricsDocument document : documents) {
            index++;
            if (document.source() != DocumentSource.COVERAGE || document.elements() == null) {
                continue;
            }
            String documentId = documentId(document, index);
            for (ParsedCodeElement element : document.elements()) {
                if (element == null || element.kind() == null) {
                    continue;
                }
                String fqn = element.fullyQualifiedName();
                if (fqn == null || fqn.isBlank()) {
                    continue;
                }
                if (element.kind() == ElementKind.TYPE) {
                    record(typeOrigins, "type", fqn, documentId);
                } else if (element.kind() == ElementKind.MEMBER) {
                    record(memberOrigins, "member", fqn, documentId);
                }
            }
        }
    }

    private static void record(Map<String, String> origins, String kind, String fqn, String documentId) {
        String previous = origins.putIfAbsent(fqn, documentId);
        if (previous != null && !previous.equals(documentId)) {
            throw new DuplicateSymbolException(kind, fqn, previous, documentId);
        }
    }

    static String documentId(ParsedMetricsDocument document, int index) {
        String path = document.sourcePath();
        return path != null && !path.isBlank() ? path : "document#" + index;
    }
}
