package io.tissueflow.batch;

import io.tissueflow.model.Batch;
import io.tissueflow.model.JobDescriptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class BatchPaths {
    private final Path experimentRoot;

    public BatchPaths(Path experimentRoot) {
        this.experimentRoot = experimentRoot.toAbsolutePath().normalize();
    }

    public Path experimentRoot() {
        return experimentRoot;
    }

    public Batch toAbsolute(Batch batch) {
        return batch.mapPaths(this::absolute);
    }

    public Batch toRelative(Batch batch) {
        return batch.mapPaths(this::relative);
    }

    public JobDescriptions toAbsolute(JobDescriptions descriptions) {
        List<Batch> run = new ArrayList<>(descriptions.run().size());
        for (Batch batch : descriptions.run()) {
            run.add(toAbsolute(batch));
        }
        return new JobDescriptions(run, descriptions.collectBatch().map(this::toAbsolute).orElse(null));
    }

    public JobDescriptions toRelative(JobDescriptions descriptions) {
        List<Batch> run = new ArrayList<>(descriptions.run().size());
        for (Batch batch : descriptions.run()) {
            run.add(toRelative(batch));
        }
        return new JobDescriptions(run, descriptions.collectBatch().map(this::toRelative).orElse(null));
    }

    private Path absolute(Path path) {
        if (path.isAbsolute()) {
            return path;
        }
        return experimentRoot.resolve(path);
    }

    private Path relative(Path path) {
        if (!path.isAbsolute()) {
            return path;
        }
        return experimentRoot.relativize(path);
    }
}
