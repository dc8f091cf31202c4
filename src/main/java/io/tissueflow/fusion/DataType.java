package io.tissueflow.fusion;

import java.util.Locale;

public enum DataType {
    INT64("int64"),
    FLOAT64("float64"),
    BOOL("bool"),
    STRING("string");

    private final String label;

    DataType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DataType fromString(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (DataType type : values()) {
                if (type.label.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown data type: " + raw);
    }

    public Object fillValue() {
        return switch (this) {
            case INT64 -> 0L;
            case FLOAT64 -> 0.0d;
            case BOOL -> Boolean.FALSE;
            case STRING -> "";
        };
    }

    public Object coerce(Object value) {
        if (value == null) {
            return fillValue();
        }
        return switch (this) {
            case INT64 -> value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString());
            case FLOAT64 -> value instanceof Number ? ((Number) value).doubleValue() : Double.parseDouble(value.toString());
            case BOOL -> value instanceof Boolean ? value : Boolean.parseBoolean(value.toString());
            case STRING -> value.toString();
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
