package io.tissueflow.workflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class WorkflowStageDescription {
    private final StageName name;
    private final DependencyRegistry registry;
    private final List<WorkflowStepDescription> steps = new ArrayList<>();
    private boolean frozen;

    public WorkflowStageDescription(StageName name) {
        this(name, DependencyRegistry.canonical());
    }

    public WorkflowStageDescription(StageName name, DependencyRegistry registry) {
        if (name == null) {
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.UNKNOWN_STAGE,
                    "Stage name cannot be empty"
            );
        }
        this.name = registry.validateStage(name.label());
        this.registry = registry;
    }

    public StageName name() {
        return name;
    }

    public List<WorkflowStepDescription> steps() {
        return Collections.unmodifiableList(steps);
    }

    public boolean contains(StepName step) {
        for (WorkflowStepDescription existing : steps) {
            if (existing.name() == step) {
                return true;
            }
        }
        return false;
    }

    public WorkflowStageDescription addStep(WorkflowStepDescription step) {
        if (frozen) {
            throw new IllegalStateException("Stage \"" + name + "\" is already part of a workflow");
        }
        registry.validateStep(step.name().label(), name);
        if (contains(step.name())) {
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.DUPLICATE_STEP,
                    "Step \"" + step.name() + "\" already exists in stage \"" + name + "\""
            );
        }
        for (StepName upstream : registry.upstreamStepsOf(step.name())) {
            if (!contains(upstream)) {
                throw new WorkflowDescriptionException(
                        WorkflowDescriptionException.Reason.MISSING_UPSTREAM_STEP,
                        "Step \"" + step.name() + "\" requires upstream step \"" + upstream + "\""
                );
            }
        }
        steps.add(step);
        return this;
    }

    void freeze() {
        frozen = true;
    }

    @Override
    public String toString() {
        return "WorkflowStageDescription{name=" + name + ", steps=" + steps + "}";
    }
}
