package io.tissueflow.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

public record NestedPathList(List<List<Path>> groups) implements PathValue {
    public NestedPathList {
        List<List<Path>> copy = new ArrayList<>();
        if (groups != null) {
            for (List<Path> group : groups) {
                copy.add(group == null ? List.of() : List.copyOf(group));
            }
        }
        groups = List.copyOf(copy);
    }

    @Override
    public NestedPathList map(UnaryOperator<Path> fn) {
        List<List<Path>> out = new ArrayList<>(groups.size());
        for (List<Path> group : groups) {
            List<Path> mapped = new ArrayList<>(group.size());
            for (Path path : group) {
                mapped.add(fn.apply(path));
            }
            out.add(mapped);
        }
        return new NestedPathList(out);
    }

    @Override
    public List<Path> flatten() {
        List<Path> out = new ArrayList<>();
        groups.forEach(out::addAll);
        return out;
    }
}
