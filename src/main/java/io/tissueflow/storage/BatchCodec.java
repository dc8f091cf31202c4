package io.tissueflow.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tissueflow.batch.JobDescriptionException;
import io.tissueflow.model.Batch;
import io.tissueflow.model.NestedPathList;
import io.tissueflow.model.PathList;
import io.tissueflow.model.PathMap;
import io.tissueflow.model.PathValue;
import io.tissueflow.util.Jsons;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BatchCodec {
    private BatchCodec() {
    }

    public static ObjectNode toJson(Batch batch) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        if (batch.id() != null) {
            node.put("id", batch.id());
        }
        node.set("inputs", encodeValues(batch.inputs()));
        node.set("outputs", encodeValues(batch.outputs()));
        if (!batch.removals().isEmpty()) {
            ArrayNode removals = node.putArray("removals");
            batch.removals().forEach(removals::add);
        }
        return node;
    }

    public static Batch fromJson(JsonNode node, String source) {
        if (node == null || !node.isObject()) {
            throw malformed(source, "batch must be a JSON object");
        }
        Integer id = null;
        if (node.hasNonNull("id")) {
            if (!node.get("id").canConvertToInt()) {
                throw malformed(source, "\"id\" must be an integer");
            }
            id = node.get("id").asInt();
        }
        Map<String, PathValue> inputs = decodeValues(node.get("inputs"), "inputs", source);
        Map<String, PathValue> outputs = decodeValues(node.get("outputs"), "outputs", source);
        List<String> removals = new ArrayList<>();
        for (JsonNode removal : node.path("removals")) {
            removals.add(removal.asText());
        }
        return new Batch(id, inputs, outputs, removals);
    }

    private static ObjectNode encodeValues(Map<String, PathValue> values) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        values.forEach((key, value) -> out.set(key, encodeValue(key, value)));
        return out;
    }

    private static JsonNode encodeValue(String key, PathValue value) {
        if (value instanceof PathList) {
            return encodePaths(((PathList) value).paths());
        }
        if (value instanceof NestedPathList) {
            // an empty outer list reads back as a flat list
            if (((NestedPathList) value).groups().isEmpty()) {
                throw new JobDescriptionException(
                        JobDescriptionException.Reason.MALFORMED_SHAPE,
                        "Nested path list \"" + key + "\" must hold at least one group"
                );
            }
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (List<Path> group : ((NestedPathList) value).groups()) {
                out.add(encodePaths(group));
            }
            return out;
        }
        if (value instanceof PathMap) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            ((PathMap) value).entries().forEach((entryKey, paths) -> out.set(entryKey, encodePaths(paths)));
            return out;
        }
        throw new IllegalArgumentException("Unsupported path value: " + value);
    }

    private static ArrayNode encodePaths(List<Path> paths) {
        ArrayNode out = Jsons.mapper().createArrayNode();
        for (Path path : paths) {
            out.add(path.toString().replace('\\', '/'));
        }
        return out;
    }

    private static Map<String, PathValue> decodeValues(JsonNode node, String field, String source) {
        Map<String, PathValue> out = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isObject()) {
            throw malformed(source, "\"" + field + "\" must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            out.put(entry.getKey(), decodeValue(entry.getValue(), field + "." + entry.getKey(), source));
        }
        return out;
    }

    private static PathValue decodeValue(JsonNode node, String key, String source) {
        if (node.isObject()) {
            Map<String, List<Path>> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (!entry.getValue().isArray()) {
                    throw malformed(source, "value of \"" + key + "." + entry.getKey() + "\" must be a list");
                }
                entries.put(entry.getKey(), decodePaths(entry.getValue(), key + "." + entry.getKey(), source));
            }
            return new PathMap(entries);
        }
        if (!node.isArray()) {
            throw malformed(source, "value of \"" + key + "\" must be a list, a list of lists or a mapping");
        }
        if (node.isEmpty() || node.get(0).isTextual()) {
            return new PathList(decodePaths(node, key, source));
        }
        if (node.get(0).isArray()) {
            List<List<Path>> groups = new ArrayList<>();
            for (JsonNode group : node) {
                if (!group.isArray()) {
                    throw malformed(source, "\"" + key + "\" mixes lists and scalars");
                }
                groups.add(decodePaths(group, key, source));
            }
            return new NestedPathList(groups);
        }
        throw malformed(source, "value of \"" + key + "\" must contain paths");
    }

    private static List<Path> decodePaths(JsonNode array, String key, String source) {
        List<Path> out = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw malformed(source, "\"" + key + "\" must only contain path strings");
            }
            out.add(Path.of(item.asText()));
        }
        return out;
    }

    private static JobDescriptionException malformed(String source, String detail) {
        return new JobDescriptionException(
                JobDescriptionException.Reason.MALFORMED_SHAPE,
                "Malformed job description " + source + ": " + detail
        );
    }
}
