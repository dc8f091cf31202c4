package io.tissueflow.fusion;

import java.util.List;

public interface FragmentStore extends AutoCloseable {
    boolean exists(String path);

    boolean isGroup(String path);

    List<String> listGroups(String group);

    List<String> listDatasets(String group);

    DataType dataType(String dataset);

    List<Integer> dimensions(String dataset);

    Dataset read(String dataset);

    void write(String dataset, Dataset data);

    void preallocate(String dataset, DataType type, int length);

    /**
     * Overwrites elements {@code [offset, offset + rows)} of an existing one-dimensional dataset.
     */
    void writeAt(String dataset, int offset, Dataset data);

    @Override
    void close();
}
