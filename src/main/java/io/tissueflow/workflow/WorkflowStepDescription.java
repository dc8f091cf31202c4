package io.tissueflow.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record WorkflowStepDescription(StepName name, Map<String, Object> args) {
    public WorkflowStepDescription {
        if (name == null) {
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.UNKNOWN_STEP,
                    "Step name cannot be empty"
            );
        }
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public static WorkflowStepDescription of(StepName name) {
        return new WorkflowStepDescription(name, Map.of());
    }
}
