package io.tissueflow.batch;

import io.tissueflow.config.ExperimentLayout;
import io.tissueflow.fusion.DataType;
import io.tissueflow.fusion.Dataset;
import io.tissueflow.fusion.DatasetFusion;
import io.tissueflow.fusion.FusionResult;
import io.tissueflow.fusion.JsonFragmentStore;
import io.tissueflow.model.Batch;
import io.tissueflow.model.JobDescriptions;
import io.tissueflow.model.PathList;
import io.tissueflow.model.PathValue;
import io.tissueflow.workflow.StepName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the files of an input directory into fixed-size run batches. Each
 * run job writes one data fragment; the collect job fuses them into the
 * step's data file.
 *
 * <p>Arguments: {@code input_dir} (required, relative to the experiment
 * root unless absolute), {@code pattern} (glob, default {@code *}),
 * {@code batch_size} (default 10), {@code fuse} (default true).
 */
public final class FileBatchPlanner extends BatchPlanner {
    private static final Logger log = LoggerFactory.getLogger(FileBatchPlanner.class);

    public static final String IMAGE_FILES = "image_files";
    public static final String DATA_FILES = "data_files";
    public static final int DEFAULT_BATCH_SIZE = 10;
    static final String OBJECTS_GROUP = "objects/files";

    private final DatasetFusion fusion;

    public FileBatchPlanner(long experimentId, StepName step, ExperimentLayout layout, int verbosity) {
        this(experimentId, step, layout, verbosity, new DatasetFusion());
    }

    public FileBatchPlanner(long experimentId, StepName step, ExperimentLayout layout, int verbosity, DatasetFusion fusion) {
        super(experimentId, step, layout, verbosity);
        this.fusion = fusion;
    }

    @Override
    protected JobDescriptions createBatches(Map<String, Object> args) {
        Path inputDir = inputDir(args);
        String pattern = String.valueOf(args.getOrDefault("pattern", "*"));
        int batchSize = intArg(args, "batch_size", DEFAULT_BATCH_SIZE);
        boolean fuse = Boolean.parseBoolean(String.valueOf(args.getOrDefault("fuse", "true")));
        if (batchSize <= 0) {
            throw new IllegalArgumentException("The value of \"batch_size\" must be positive: " + batchSize);
        }

        List<Path> files = listFiles(inputDir, pattern);
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No files matching \"" + pattern + "\" in " + inputDir);
        }
        log.debug("found {} input file(s) for step \"{}\"", files.size(), step);

        List<Batch> run = new ArrayList<>();
        List<Path> fragments = new ArrayList<>();
        int id = 1;
        for (List<Path> chunk : partition(files, batchSize)) {
            Path fragment = fragmentFile(id);
            fragments.add(fragment);
            Map<String, PathValue> inputs = new LinkedHashMap<>();
            inputs.put(IMAGE_FILES, new PathList(chunk));
            Map<String, PathValue> outputs = new LinkedHashMap<>();
            outputs.put(DATA_FILES, PathList.of(fragment));
            run.add(Batch.run(id, inputs, outputs));
            id++;
        }
        if (!fuse) {
            return JobDescriptions.runOnly(run);
        }
        Map<String, PathValue> inputs = new LinkedHashMap<>();
        inputs.put(DATA_FILES, new PathList(fragments));
        Map<String, PathValue> outputs = new LinkedHashMap<>();
        outputs.put(DATA_FILES, PathList.of(dataFile()));
        return new JobDescriptions(run, Batch.collect(inputs, outputs, List.of(DATA_FILES)));
    }

    @Override
    public void runJob(Batch batch) {
        List<Path> files = valueOf(batch.inputs(), IMAGE_FILES, batch).flatten();
        List<Path> outputs = valueOf(batch.outputs(), DATA_FILES, batch).flatten();
        if (outputs.size() != 1) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.MALFORMED_SHAPE,
                    "Run batch " + batch.id() + " of step \"" + step + "\" needs exactly one \"" + DATA_FILES + "\" output"
            );
        }
        List<Object> ids = new ArrayList<>();
        List<Object> names = new ArrayList<>();
        List<Object> sizes = new ArrayList<>();
        for (Path file : files) {
            ids.add((long) ids.size() + 1);
            names.add(file.getFileName().toString());
            try {
                sizes.add(Files.size(file));
            } catch (IOException e) {
                throw new RuntimeException("Failed to read size of input file: " + file, e);
            }
        }
        Path fragment = outputs.get(0);
        try (JsonFragmentStore store = JsonFragmentStore.open(fragment)) {
            store.write("metadata/job_id", Dataset.longs(batch.id()));
            store.write("metadata/file_count", Dataset.longs(files.size()));
            store.write(OBJECTS_GROUP + "/segmentation/object_ids", Dataset.of(DataType.INT64, ids));
            store.write(OBJECTS_GROUP + "/features/file_name", Dataset.of(DataType.STRING, names));
            store.write(OBJECTS_GROUP + "/features/size_bytes", Dataset.of(DataType.INT64, sizes));
        }
        log.info("wrote fragment {} for {} file(s)", fragment, files.size());
    }

    @Override
    public void collectJobOutput(Batch batch) {
        PathValue fragments = valueOf(batch.inputs(), DATA_FILES, batch);
        PathValue output = valueOf(batch.outputs(), DATA_FILES, batch);
        if (output.flatten().size() != 1) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.MALFORMED_SHAPE,
                    "Collect batch of step \"" + step + "\" needs \"" + DATA_FILES
                            + "\" inputs and exactly one \"" + DATA_FILES + "\" output"
            );
        }
        boolean delete = batch.removals().contains(DATA_FILES);
        FusionResult result = fusion.fuse(fragments.flatten(), output.flatten().get(0), delete);
        log.info("collected {} fragment(s) of step \"{}\": {}", result.fragments(), step, result.rowsPerCategory());
    }

    @Override
    public void initialize() {
        super.initialize();
        try {
            Files.createDirectories(layout.dataDir(step.label()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to create data directory of step: " + step, e);
        }
    }

    public Path fragmentFile(int jobId) {
        return layout.dataDir(step.label()).resolve(String.format("%s_%06d.data.json", step.label(), jobId));
    }

    public Path dataFile() {
        return layout.dataDir(step.label()).resolve(step.label() + ".data.json");
    }

    private PathValue valueOf(Map<String, PathValue> values, String key, Batch batch) {
        PathValue value = values.get(key);
        if (value == null) {
            throw new JobDescriptionException(
                    JobDescriptionException.Reason.MALFORMED_SHAPE,
                    "Batch " + batch.id() + " of step \"" + step + "\" has no \"" + key + "\" entry"
            );
        }
        return value;
    }

    private Path inputDir(Map<String, Object> args) {
        Object raw = args.get("input_dir");
        if (raw == null || String.valueOf(raw).isBlank()) {
            throw new IllegalArgumentException("Argument \"input_dir\" is required for step \"" + step + "\"");
        }
        Path dir = Paths.get(String.valueOf(raw));
        return dir.isAbsolute() ? dir : layout.experimentRoot().resolve(dir);
    }

    private static int intArg(Map<String, Object> args, String key, int fallback) {
        Object raw = args.get(key);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number) {
            return ((Number) raw).intValue();
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("The value of \"" + key + "\" must be an integer: " + raw, e);
        }
    }

    private static List<Path> listFiles(Path dir, String pattern) {
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Input directory does not exist: " + dir);
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, pattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path.toAbsolutePath().normalize());
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list input files in " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
