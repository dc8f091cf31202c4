package io.tissueflow.workflow;

import java.util.ArrayList;
import java.util.List;

public enum StepName {
    METAEXTRACT("metaextract", StageName.IMAGE_CONVERSION),
    METACONFIG("metaconfig", StageName.IMAGE_CONVERSION),
    IMEXTRACT("imextract", StageName.IMAGE_CONVERSION),
    CORILLA("corilla", StageName.IMAGE_PREPROCESSING),
    ALIGN("align", StageName.IMAGE_PREPROCESSING),
    ILLUMINATI("illuminati", StageName.PYRAMID_CREATION),
    JTERATOR("jterator", StageName.IMAGE_ANALYSIS);

    private final String label;
    private final StageName stage;

    StepName(String label, StageName stage) {
        this.label = label;
        this.stage = stage;
    }

    public String label() {
        return label;
    }

    public StageName stage() {
        return stage;
    }

    public static StepName fromString(String raw) {
        if (raw != null && !raw.isBlank()) {
            for (StepName value : values()) {
                if (value.label.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                    return value;
                }
            }
        }
        List<String> known = new ArrayList<>();
        for (StepName value : values()) {
            known.add(value.label);
        }
        throw new WorkflowDescriptionException(
                WorkflowDescriptionException.Reason.UNKNOWN_STEP,
                "Unknown step \"" + raw + "\". Known steps are: " + known
        );
    }

    @Override
    public String toString() {
        return label;
    }
}
