package io.tissueflow.model;

import java.nio.file.Path;
import java.util.List;
import java.util.function.UnaryOperator;

public interface PathValue {

    PathValue map(UnaryOperator<Path> fn);

    List<Path> flatten();
}
