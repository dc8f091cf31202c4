package io.tissueflow.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Validated, append-only sequence of workflow stages.
 *
 * <p>Insertion order is the only ordering mechanism: a stage can never be
 * placed before one that is already present. Missing upstream stages are
 * reported as warnings; everything else that contradicts the
 * {@link DependencyRegistry} is rejected with a
 * {@link WorkflowDescriptionException}.
 */
public final class WorkflowDescription {
    private static final Logger log = LoggerFactory.getLogger(WorkflowDescription.class);

    private final DependencyRegistry registry;
    private final List<WorkflowStageDescription> stages = new ArrayList<>();

    public WorkflowDescription() {
        this(DependencyRegistry.canonical());
    }

    public WorkflowDescription(DependencyRegistry registry) {
        this.registry = registry;
    }

    public DependencyRegistry registry() {
        return registry;
    }

    public List<WorkflowStageDescription> stages() {
        return Collections.unmodifiableList(stages);
    }

    public Optional<WorkflowStageDescription> stage(StageName name) {
        for (WorkflowStageDescription stage : stages) {
            if (stage.name() == name) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    public WorkflowDescription addStage(WorkflowStageDescription stage) {
        StageName name = registry.validateStage(stage.name().label());
        if (stage(name).isPresent()) {
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.DUPLICATE_STAGE,
                    "Stage \"" + name + "\" already exists"
            );
        }
        for (WorkflowStageDescription existing : stages) {
            if (registry.upstreamStagesOf(existing.name()).contains(name)) {
                throw new WorkflowDescriptionException(
                        WorkflowDescriptionException.Reason.ORDER_VIOLATION,
                        "Stage \"" + name + "\" must be upstream of stage \"" + existing.name() + "\""
                );
            }
        }
        for (StepName required : registry.stepsOf(name)) {
            if (!stage.contains(required)) {
                throw new WorkflowDescriptionException(
                        WorkflowDescriptionException.Reason.INCOMPLETE_STAGE,
                        "Stage \"" + name + "\" requires the following steps: " + registry.stepsOf(name)
                );
            }
        }
        for (StageName upstream : registry.upstreamStagesOf(name)) {
            if (stage(upstream).isEmpty()) {
                log.warn("Stage \"{}\" requires upstream stage \"{}\"", name, upstream);
            }
        }
        stage.freeze();
        stages.add(stage);
        return this;
    }

    public List<WorkflowStepDescription> steps() {
        List<WorkflowStepDescription> out = new ArrayList<>();
        for (WorkflowStageDescription stage : stages) {
            out.addAll(stage.steps());
        }
        return out;
    }
}
