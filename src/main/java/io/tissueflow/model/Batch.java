package io.tissueflow.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

public record Batch(
        Integer id,
        Map<String, PathValue> inputs,
        Map<String, PathValue> outputs,
        List<String> removals
) {
    public static final int MAX_RUN_BATCHES = 1_000_000;

    public Batch {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        removals = removals == null ? List.of() : List.copyOf(removals);
    }

    public static Batch run(int id, Map<String, PathValue> inputs, Map<String, PathValue> outputs) {
        return new Batch(id, inputs, outputs, List.of());
    }

    public static Batch collect(Map<String, PathValue> inputs, Map<String, PathValue> outputs, List<String> removals) {
        return new Batch(null, inputs, outputs, removals);
    }

    public boolean isCollect() {
        return id == null;
    }

    public Batch mapPaths(UnaryOperator<Path> fn) {
        return new Batch(id, mapValues(inputs, fn), mapValues(outputs, fn), removals);
    }

    public List<Path> inputFiles() {
        return flattenValues(inputs);
    }

    public List<Path> outputFiles() {
        return flattenValues(outputs);
    }

    private static Map<String, PathValue> mapValues(Map<String, PathValue> values, UnaryOperator<Path> fn) {
        Map<String, PathValue> out = new LinkedHashMap<>();
        values.forEach((key, value) -> out.put(key, value.map(fn)));
        return out;
    }

    private static List<Path> flattenValues(Map<String, PathValue> values) {
        List<Path> out = new ArrayList<>();
        for (PathValue value : values.values()) {
            out.addAll(value.flatten());
        }
        return out;
    }
}
