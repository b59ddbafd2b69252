package com.metricsfusion.core.report;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.metricsfusion.core.model.MemberKind;
import com.metricsfusion.core.model.MetricIdentifier;
import com.metricsfusion.core.model.MetricValue;
import com.metricsfusion.core.model.MetricsNode;
import com.metricsfusion.core.model.NodeKind;
import com.metricsfusion.core.model.SourceLocation;
import com.metricsfusion.core.model.ThresholdStatus;

import java.lang.reflect.Type;
import java.util.Map;

/**
 * Writes a {@link MetricsNode} with its kind-specific child array ({@code assemblies},
 * {@code namespaces}, {@code types}, {@code members}) and reads it back.
 *
 * Metrics are keyed by JSON id in enum order; NotApplicable entries are never written.
 * On read, unknown metric ids are skipped.
 */
public class MetricsNodeAdapter implements JsonSerializer<MetricsNode>, JsonDeserializer<MetricsNode> {

    @Override
    public JsonElement serialize(MetricsNode node, Type typeOfSrc, JsonSerializationContext context) {
        JsonObject json = new JsonObject();
        json.addProperty("kind", node.kind().label());
        json.addProperty("name", node.name());
        json.addProperty("fullyQualifiedName", node.fullyQualifiedName());

        JsonObject metrics = new JsonObject();
        for (Map.Entry<MetricIdentifier, MetricValue> entry : node.metrics().entrySet()) {
            MetricValue value = entry.getValue();
            if (value.status == ThresholdStatus.NOT_APPLICABLE) continue;
            metrics.add(entry.getKey().id(), context.serialize(value, MetricValue.class));
        }
        json.add("metrics", metrics);

        if (node.source() != null) {
            json.add("source", context.serialize(node.source(), SourceLocation.class));
        }
        if (node.kind() == NodeKind.MEMBER) {
            json.add("memberKind", context.serialize(node.memberKind(), MemberKind.class));
            json.addProperty("includesSynthesizedCoverage", node.includesSynthesizedCoverage());
        }
        if (node.isNew()) {
            json.addProperty("isNew", true);
        }

        String childrenProperty = node.kind().childrenProperty();
        if (childrenProperty != null) {
            JsonArray children = new JsonArray();
            for (MetricsNode child : node.children()) {
                children.add(serialize(child, MetricsNode.class, context));
            }
            json.add(childrenProperty, children);
        }
        return json;
    }

    @Override
    public MetricsNode deserialize(JsonElement element, Type typeOfT, JsonDeserializationContext context) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("Expected a node object but found: " + element);
        }
        JsonObject json = element.getAsJsonObject();
        String kindLabel = stringOrNull(json, "kind");
        NodeKind kind = NodeKind.fromLabel(kindLabel)
                .orElseThrow(() -> new JsonParseException("Unknown node kind: " + kindLabel));

        MetricsNode node = new MetricsNode(kind, stringOrNull(json, "name"), stringOrNull(json, "fullyQualifiedName"));

        JsonElement metrics = json.get("metrics");
        if (metrics != null && metrics.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : metrics.getAsJsonObject().entrySet()) {
                MetricIdentifier metric = MetricIdentifier.fromId(entry.getKey()).orElse(null);
                if (metric == null) continue;
                MetricValue value = context.deserialize(entry.getValue(), MetricValue.class);
                if (value == null) continue;
                if (value.status == null) {
                    value.status = ThresholdStatus.NOT_APPLICABLE;
                }
                value.unit = metric.unit();
                node.putMetric(metric, value);
            }
        }

        JsonElement source = json.get("source");
        if (source != null && source.isJsonObject()) {
            node.setSource(context.deserialize(source, SourceLocation.class));
        }
        if (kind == NodeKind.MEMBER) {
            JsonElement memberKind = json.get("memberKind");
            if (memberKind != null && !memberKind.isJsonNull()) {
                node.setMemberKind(context.deserialize(memberKind, MemberKind.class));
            }
            if (booleanOr(json, "includesSynthesizedCoverage")) {
                node.markSynthesizedCoverage();
            }
        }
        node.setNew(booleanOr(json, "isNew"));

        String childrenProperty = kind.childrenProperty();
        JsonElement children = childrenProperty != null ? json.get(childrenProperty) : null;
        if (children != null && children.isJsonArray()) {
            for (JsonElement child : children.getAsJsonArray()) {
                node.addChild(deserialize(child, MetricsNode.class, context));
            }
        }
        return node;
    }

    private static String stringOrNull(JsonObject json, String property) {
        JsonElement value = json.get(property);
        return value == null || value.isJsonNull() ? null : value.getAsString();
    }

    private static boolean booleanOr(JsonObject json, String property) {
        JsonElement value = json.get(property);
        return value != null && value.isJsonPrimitive() && value.getAsBoolean();
    }
}
