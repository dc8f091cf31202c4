package io.tissueflow.workflow;

public enum StageName {
    IMAGE_CONVERSION("image_conversion"),
    IMAGE_PREPROCESSING("image_preprocessing"),
    PYRAMID_CREATION("pyramid_creation"),
    IMAGE_ANALYSIS("image_analysis");

    private final String label;

    StageName(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static StageName fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.UNKNOWN_STAGE,
                    "Stage name cannot be empty"
            );
        }
        for (StageName value : values()) {
            if (value.label.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new WorkflowDescriptionException(
                WorkflowDescriptionException.Reason.UNKNOWN_STAGE,
                "Unknown stage \"" + raw + "\". Known stages are: " + knownLabels()
        );
    }

    static String knownLabels() {
        StringBuilder sb = new StringBuilder();
        for (StageName value : values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append('"').append(value.label).append('"');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return label;
    }
}
