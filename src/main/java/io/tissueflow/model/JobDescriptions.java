package io.tissueflow.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record JobDescriptions(List<Batch> run, Batch collect) {
    public JobDescriptions {
        run = run == null ? List.of() : List.copyOf(run);
        if (collect != null && !collect.isCollect()) {
            throw new IllegalArgumentException("Collect batch must not carry a job id: " + collect.id());
        }
    }

    public static JobDescriptions runOnly(List<Batch> run) {
        return new JobDescriptions(run, null);
    }

    public boolean hasCollect() {
        return collect != null;
    }

    public Optional<Batch> collectBatch() {
        return Optional.ofNullable(collect);
    }

    public List<Path> inputFiles() {
        List<Path> out = new ArrayList<>();
        for (Batch batch : run) {
            out.addAll(batch.inputFiles());
        }
        return out;
    }

    public List<Path> outputFiles() {
        List<Path> out = new ArrayList<>();
        for (Batch batch : run) {
            out.addAll(batch.outputFiles());
        }
        if (collect != null) {
            out.addAll(collect.outputFiles());
        }
        return out;
    }
}
