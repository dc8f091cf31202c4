package io.tissueflow.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

public record PathList(List<Path> paths) implements PathValue {
    public PathList {
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public static PathList of(Path... paths) {
        return new PathList(List.of(paths));
    }

    @Override
    public PathList map(UnaryOperator<Path> fn) {
        List<Path> out = new ArrayList<>(paths.size());
        for (Path path : paths) {
            out.add(fn.apply(path));
        }
        return new PathList(out);
    }

    @Override
    public List<Path> flatten() {
        return paths;
    }
}
