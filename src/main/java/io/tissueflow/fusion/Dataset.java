package io.tissueflow.fusion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record Dataset(DataType type, List<Integer> shape, List<Object> values) {
    public Dataset {
        if (type == null) {
            throw new IllegalArgumentException("Dataset type cannot be null");
        }
        shape = shape == null ? List.of() : List.copyOf(shape);
        long expected = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Dataset dimensions must not be negative: " + shape);
            }
            expected *= dim;
        }
        List<Object> coerced = new ArrayList<>(values == null ? 0 : values.size());
        if (values != null) {
            for (Object value : values) {
                coerced.add(type.coerce(value));
            }
        }
        if (coerced.size() != expected) {
            throw new IllegalArgumentException(
                    "Dataset of shape " + shape + " needs " + expected + " values, got " + coerced.size()
            );
        }
        values = Collections.unmodifiableList(coerced);
    }

    public static Dataset of(DataType type, List<?> values) {
        List<Object> copy = new ArrayList<>(values);
        return new Dataset(type, List.of(copy.size()), copy);
    }

    public static Dataset longs(long... values) {
        List<Object> out = new ArrayList<>(values.length);
        for (long value : values) {
            out.add(value);
        }
        return of(DataType.INT64, out);
    }

    public static Dataset doubles(double... values) {
        List<Object> out = new ArrayList<>(values.length);
        for (double value : values) {
            out.add(value);
        }
        return of(DataType.FLOAT64, out);
    }

    public static Dataset strings(String... values) {
        return of(DataType.STRING, List.of(values));
    }

    public static Dataset filled(DataType type, int length) {
        return of(type, Collections.nCopies(length, type.fillValue()));
    }

    public int rank() {
        return shape.size();
    }

    public int rows() {
        return shape.isEmpty() ? 1 : shape.get(0);
    }
}
