package io.tissueflow.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

public record PathMap(Map<String, List<Path>> entries) implements PathValue {
    public PathMap {
        Map<String, List<Path>> copy = new LinkedHashMap<>();
        if (entries != null) {
            entries.forEach((key, value) -> copy.put(key, value == null ? List.of() : List.copyOf(value)));
        }
        entries = Collections.unmodifiableMap(copy);
    }

    @Override
    public PathMap map(UnaryOperator<Path> fn) {
        Map<String, List<Path>> out = new LinkedHashMap<>();
        entries.forEach((key, value) -> {
            List<Path> mapped = new ArrayList<>(value.size());
            for (Path path : value) {
                mapped.add(fn.apply(path));
            }
            out.put(key, mapped);
        });
        return new PathMap(out);
    }

    @Override
    public List<Path> flatten() {
        List<Path> out = new ArrayList<>();
        entries.values().forEach(out::addAll);
        return out;
    }
}
