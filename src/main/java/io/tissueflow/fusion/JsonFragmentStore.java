package io.tissueflow.fusion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tissueflow.util.Jsons;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public final class JsonFragmentStore implements FragmentStore {
    private static final String GROUPS = "groups";
    private static final String DATASETS = "datasets";

    private final Path file;
    private final ObjectNode root;
    private boolean dirty;

    private JsonFragmentStore(Path file, ObjectNode root, boolean dirty) {
        this.file = file;
        this.root = root;
        this.dirty = dirty;
    }

    public static JsonFragmentStore open(Path file) {
        if (!Files.exists(file)) {
            return new JsonFragmentStore(file, emptyGroup(), false);
        }
        JsonNode tree = Jsons.readTree(file);
        if (!tree.isObject()) {
            throw new IllegalArgumentException("Not a fragment file: " + file);
        }
        return new JsonFragmentStore(file, (ObjectNode) tree, false);
    }

    public Path file() {
        return file;
    }

    @Override
    public boolean exists(String path) {
        return isGroup(path) || datasetNode(path) != null;
    }

    @Override
    public boolean isGroup(String path) {
        return groupNode(segments(path)) != null;
    }

    @Override
    public List<String> listGroups(String group) {
        return childNames(groupNode(segments(group)), GROUPS);
    }

    @Override
    public List<String> listDatasets(String group) {
        return childNames(groupNode(segments(group)), DATASETS);
    }

    @Override
    public DataType dataType(String dataset) {
        return DataType.fromString(requireDataset(dataset).path("type").asText());
    }

    @Override
    public List<Integer> dimensions(String dataset) {
        List<Integer> out = new ArrayList<>();
        for (JsonNode dim : requireDataset(dataset).path("shape")) {
            out.add(dim.asInt());
        }
        return out;
    }

    @Override
    public Dataset read(String dataset) {
        ObjectNode node = requireDataset(dataset);
        DataType type = DataType.fromString(node.path("type").asText());
        List<Object> values = new ArrayList<>();
        for (JsonNode value : node.path("data")) {
            values.add(decode(type, value));
        }
        return new Dataset(type, dimensions(dataset), values);
    }

    @Override
    public void write(String dataset, Dataset data) {
        List<String> parts = segments(dataset);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Dataset path cannot be empty");
        }
        ObjectNode parent = ensureGroup(parts.subList(0, parts.size() - 1));
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", data.type().label());
        ArrayNode shape = node.putArray("shape");
        data.shape().forEach(shape::add);
        ArrayNode values = node.putArray("data");
        for (Object value : data.values()) {
            values.add(encode(data.type(), value));
        }
        child(parent, DATASETS).set(parts.get(parts.size() - 1), node);
        dirty = true;
    }

    @Override
    public void preallocate(String dataset, DataType type, int length) {
        write(dataset, Dataset.filled(type, length));
    }

    @Override
    public void writeAt(String dataset, int offset, Dataset data) {
        ObjectNode node = requireDataset(dataset);
        List<Integer> dims = dimensions(dataset);
        if (dims.size() != 1 || data.rank() > 1) {
            throw new IllegalArgumentException("Offset writes need one-dimensional datasets: " + dataset);
        }
        DataType type = DataType.fromString(node.path("type").asText());
        int rows = data.values().size();
        if (offset < 0 || offset + rows > dims.get(0)) {
            throw new IllegalArgumentException(
                    "Rows [" + offset + ", " + (offset + rows) + ") out of range for " + dataset
                            + " of length " + dims.get(0)
            );
        }
        ArrayNode values = (ArrayNode) node.get("data");
        for (int i = 0; i < rows; i++) {
            values.set(offset + i, encode(type, type.coerce(data.values().get(i))));
        }
        dirty = true;
    }

    @Override
    public void close() {
        if (dirty) {
            Jsons.writeFile(file, root);
            dirty = false;
        }
    }

    private ObjectNode requireDataset(String path) {
        ObjectNode node = datasetNode(path);
        if (node == null) {
            throw new IllegalArgumentException("Dataset does not exist: " + path + " in " + file);
        }
        return node;
    }

    private ObjectNode datasetNode(String path) {
        List<String> parts = segments(path);
        if (parts.isEmpty()) {
            return null;
        }
        ObjectNode parent = groupNode(parts.subList(0, parts.size() - 1));
        if (parent == null) {
            return null;
        }
        JsonNode node = parent.path(DATASETS).get(parts.get(parts.size() - 1));
        return node != null && node.isObject() ? (ObjectNode) node : null;
    }

    private ObjectNode groupNode(List<String> parts) {
        ObjectNode current = root;
        for (String part : parts) {
            JsonNode next = current.path(GROUPS).get(part);
            if (next == null || !next.isObject()) {
                return null;
            }
            current = (ObjectNode) next;
        }
        return current;
    }

    private ObjectNode ensureGroup(List<String> parts) {
        ObjectNode current = root;
        for (String part : parts) {
            ObjectNode groups = child(current, GROUPS);
            JsonNode next = groups.get(part);
            if (next == null || !next.isObject()) {
                next = emptyGroup();
                groups.set(part, next);
            }
            current = (ObjectNode) next;
        }
        return current;
    }

    private static ObjectNode child(ObjectNode group, String kind) {
        JsonNode node = group.get(kind);
        if (node == null || !node.isObject()) {
            return group.putObject(kind);
        }
        return (ObjectNode) node;
    }

    private static ObjectNode emptyGroup() {
        ObjectNode group = JsonNodeFactory.instance.objectNode();
        group.putObject(GROUPS);
        group.putObject(DATASETS);
        return group;
    }

    private static List<String> childNames(ObjectNode group, String kind) {
        List<String> out = new ArrayList<>();
        if (group == null) {
            return out;
        }
        Iterator<String> names = group.path(kind).fieldNames();
        names.forEachRemaining(out::add);
        return out;
    }

    private static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        if (path == null) {
            return out;
        }
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    private static JsonNode encode(DataType type, Object value) {
        return switch (type) {
            case INT64 -> JsonNodeFactory.instance.numberNode((Long) value);
            case FLOAT64 -> JsonNodeFactory.instance.numberNode((Double) value);
            case BOOL -> JsonNodeFactory.instance.booleanNode((Boolean) value);
            case STRING -> JsonNodeFactory.instance.textNode((String) value);
        };
    }

    private static Object decode(DataType type, JsonNode value) {
        return switch (type) {
            case INT64 -> value.asLong();
            case FLOAT64 -> value.asDouble();
            case BOOL -> value.asBoolean();
            case STRING -> value.asText();
        };
    }
}
