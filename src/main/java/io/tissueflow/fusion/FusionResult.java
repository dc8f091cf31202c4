package io.tissueflow.fusion;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record FusionResult(Path output, int fragments, Map<String, Integer> rowsPerCategory) {
    public FusionResult {
        rowsPerCategory = Collections.unmodifiableMap(new LinkedHashMap<>(rowsPerCategory));
    }
}
