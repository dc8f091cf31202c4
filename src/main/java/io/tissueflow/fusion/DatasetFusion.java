package io.tissueflow.fusion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Combines the data fragments written by the run jobs of one step into a
 * single dataset.
 *
 * <p>Fragments share one taxonomy: one-value {@code metadata} datasets per
 * job, and per object category under {@code objects/<category>} a
 * {@code features} group and a {@code segmentation} group (which may have
 * subgroups). Metadata row {@code i} comes from fragment {@code i}; category
 * rows are appended at a running cursor per category, so the rows of fragment
 * {@code i} occupy {@code [sum of rows of fragments 0..i-1, + rows of i)}.
 */
public final class DatasetFusion {
    private static final Logger log = LoggerFactory.getLogger(DatasetFusion.class);

    private static final String METADATA = "metadata";
    private static final String OBJECTS = "objects";
    private static final Pattern MAP_DATA_GROUP = Pattern.compile("(^|/)objects/[^/]+/map_data$");
    private static final Pattern IDS_DATASET = Pattern.compile("(^|/)objects/[^/]+/ids$");

    private final Function<Path, ? extends FragmentStore> opener;

    public DatasetFusion() {
        this(JsonFragmentStore::open);
    }

    public DatasetFusion(Function<Path, ? extends FragmentStore> opener) {
        this.opener = opener;
    }

    public FusionResult fuse(List<Path> fragments, Path output, boolean deleteFragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("At least one fragment is required");
        }
        for (Path fragment : fragments) {
            if (!Files.exists(fragment)) {
                throw new FusionException(
                        FusionException.Reason.DATA_INCOMPLETE,
                        "Fragment file does not exist: " + fragment
                );
            }
        }
        log.info("determine names and data types of the final datasets");
        Taxonomy taxonomy;
        try (FragmentStore first = opener.apply(fragments.get(0))) {
            taxonomy = discover(first);
        }

        log.info("determine dimensions of the final datasets");
        List<Map<String, Integer>> rowsPerFragment = new ArrayList<>(fragments.size());
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (String category : taxonomy.categories.keySet()) {
            totals.put(category, 0);
        }
        for (Path fragment : fragments) {
            Map<String, Integer> rows = new LinkedHashMap<>();
            try (FragmentStore store = opener.apply(fragment)) {
                for (String category : taxonomy.categories.keySet()) {
                    int n = rowCount(store, category, taxonomy, fragment);
                    rows.put(category, n);
                    totals.merge(category, n, Integer::sum);
                }
            }
            rowsPerFragment.add(rows);
        }

        deleteIfExists(output);
        try (FragmentStore out = opener.apply(output)) {
            log.info("preallocate final datasets");
            for (String path : taxonomy.metadata) {
                out.preallocate(path, taxonomy.types.get(path), fragments.size());
            }
            taxonomy.categories.forEach((category, paths) -> {
                for (String path : paths) {
                    out.preallocate(path, taxonomy.types.get(path), totals.get(category));
                }
            });

            log.info("load individual datasets and write data into final datasets");
            Map<String, Integer> cursors = new LinkedHashMap<>();
            for (String category : taxonomy.categories.keySet()) {
                cursors.put(category, 0);
            }
            for (int i = 0; i < fragments.size(); i++) {
                Path fragment = fragments.get(i);
                log.debug("process file: {}", fragment);
                try (FragmentStore store = opener.apply(fragment)) {
                    for (String path : taxonomy.metadata) {
                        Dataset data = readOneDimensional(store, path, fragment);
                        if (data.values().size() != 1) {
                            throw new FusionException(
                                    FusionException.Reason.SHAPE_ERROR,
                                    "Metadata dataset must hold exactly one value: " + path + " in " + fragment
                            );
                        }
                        out.writeAt(path, i, data);
                    }
                    for (Map.Entry<String, List<String>> entry : taxonomy.categories.entrySet()) {
                        String category = entry.getKey();
                        int rows = rowsPerFragment.get(i).get(category);
                        int cursor = cursors.get(category);
                        for (String path : entry.getValue()) {
                            Dataset data = readOneDimensional(store, path, fragment);
                            if (data.rows() != rows) {
                                throw new FusionException(
                                        FusionException.Reason.SHAPE_ERROR,
                                        "Dataset " + path + " in " + fragment + " has " + data.rows()
                                                + " rows, expected " + rows + " for objects \"" + category + "\""
                                );
                            }
                            out.writeAt(path, cursor, data);
                        }
                        cursors.put(category, cursor + rows);
                    }
                }
            }
        }
        if (deleteFragments) {
            for (Path fragment : fragments) {
                log.debug("remove input file: {}", fragment);
                deleteIfExists(fragment);
            }
        }
        log.info("fused {} fragment(s) into {}", fragments.size(), output);
        return new FusionResult(output, fragments.size(), totals);
    }

    /**
     * Copies every dataset of {@code oldFile} that {@code newFile} lacks. Map
     * data of object categories and object id datasets are never carried over.
     *
     * @return paths of the copied datasets
     */
    public List<String> merge(Path oldFile, Path newFile) {
        if (!Files.exists(oldFile)) {
            throw new IllegalArgumentException("File does not exist: " + oldFile);
        }
        List<String> copied = new ArrayList<>();
        try (FragmentStore source = opener.apply(oldFile); FragmentStore target = opener.apply(newFile)) {
            copyRecursive(source, target, "", copied);
        }
        log.info("merged {} dataset(s) from {} into {}", copied.size(), oldFile, newFile);
        return copied;
    }

    private void copyRecursive(FragmentStore source, FragmentStore target, String group, List<String> copied) {
        for (String name : source.listDatasets(group)) {
            String path = join(group, name);
            if (IDS_DATASET.matcher(path).find()) {
                log.debug("skip dataset: {}", path);
                continue;
            }
            if (!target.exists(path)) {
                log.debug("copy dataset: {}", path);
                target.write(path, source.read(path));
                copied.add(path);
            }
        }
        for (String name : source.listGroups(group)) {
            String path = join(group, name);
            if (MAP_DATA_GROUP.matcher(path).find()) {
                log.debug("skip group: {}", path);
                continue;
            }
            copyRecursive(source, target, path, copied);
        }
    }

    private Taxonomy discover(FragmentStore store) {
        Taxonomy taxonomy = new Taxonomy();
        for (String name : store.listDatasets(METADATA)) {
            taxonomy.addMetadata(store, join(METADATA, name));
        }
        for (String category : store.listGroups(OBJECTS)) {
            String features = featuresGroup(category);
            String segmentation = segmentationGroup(category);
            List<String> paths = new ArrayList<>();
            for (String name : store.listDatasets(features)) {
                paths.add(taxonomy.register(store, join(features, name)));
            }
            if (!paths.isEmpty()) {
                taxonomy.sizingDataset.put(category, paths.get(0));
            }
            for (String name : store.listDatasets(segmentation)) {
                paths.add(taxonomy.register(store, join(segmentation, name)));
            }
            for (String subgroup : store.listGroups(segmentation)) {
                String subPath = join(segmentation, subgroup);
                for (String name : store.listDatasets(subPath)) {
                    paths.add(taxonomy.register(store, join(subPath, name)));
                }
            }
            taxonomy.categories.put(category, paths);
        }
        return taxonomy;
    }

    private static int rowCount(FragmentStore store, String category, Taxonomy taxonomy, Path fragment) {
        String sizing = taxonomy.sizingDataset.get(category);
        if (sizing != null && store.exists(sizing)) {
            return firstDimension(store.dimensions(sizing));
        }
        String objectIds = join(segmentationGroup(category), "object_ids");
        if (store.exists(objectIds)) {
            return firstDimension(store.dimensions(objectIds));
        }
        throw new FusionException(
                FusionException.Reason.DATA_INCOMPLETE,
                "Features or segmentation data must exist for objects \"" + category + "\" in " + fragment
        );
    }

    private static Dataset readOneDimensional(FragmentStore store, String path, Path fragment) {
        if (!store.exists(path)) {
            throw new FusionException(
                    FusionException.Reason.DATA_INCOMPLETE,
                    "Dataset " + path + " is missing in " + fragment
            );
        }
        Dataset data = store.read(path);
        if (data.rank() > 1) {
            throw new FusionException(
                    FusionException.Reason.SHAPE_ERROR,
                    "Dataset must be one-dimensional: " + path + " in " + fragment
            );
        }
        return data;
    }

    private static int firstDimension(List<Integer> dims) {
        return dims.isEmpty() ? 1 : dims.get(0);
    }

    private static String featuresGroup(String category) {
        return OBJECTS + "/" + category + "/features";
    }

    private static String segmentationGroup(String category) {
        return OBJECTS + "/" + category + "/segmentation";
    }

    private static String join(String group, String name) {
        return group.isEmpty() ? name : group + "/" + name;
    }

    private static void deleteIfExists(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete file: " + file, e);
        }
    }

    private static final class Taxonomy {
        private final List<String> metadata = new ArrayList<>();
        private final Map<String, List<String>> categories = new LinkedHashMap<>();
        private final Map<String, String> sizingDataset = new LinkedHashMap<>();
        private final Map<String, DataType> types = new LinkedHashMap<>();

        private void addMetadata(FragmentStore store, String path) {
            metadata.add(register(store, path));
        }

        private String register(FragmentStore store, String path) {
            types.put(path, store.dataType(path));
            return path;
        }
    }
}
