package io.tissueflow.workflow;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class WorkflowDescriptionTest {

    @Test
    void canonicalOrderIsAccepted() {
        WorkflowDescription workflow = new WorkflowDescription()
                .addStage(imageConversion())
                .addStage(new WorkflowStageDescription(StageName.IMAGE_PREPROCESSING)
                        .addStep(WorkflowStepDescription.of(StepName.CORILLA))
                        .addStep(WorkflowStepDescription.of(StepName.ALIGN)))
                .addStage(new WorkflowStageDescription(StageName.PYRAMID_CREATION)
                        .addStep(WorkflowStepDescription.of(StepName.ILLUMINATI)))
                .addStage(new WorkflowStageDescription(StageName.IMAGE_ANALYSIS)
                        .addStep(new WorkflowStepDescription(StepName.JTERATOR, Map.of("pipeline", "cells"))));

        Assertions.assertEquals(4, workflow.stages().size());
        Assertions.assertEquals(StageName.IMAGE_CONVERSION, workflow.stages().get(0).name());
        Assertions.assertEquals(
                List.of(StepName.METAEXTRACT, StepName.METACONFIG, StepName.IMEXTRACT,
                        StepName.CORILLA, StepName.ALIGN, StepName.ILLUMINATI, StepName.JTERATOR),
                workflow.steps().stream().map(WorkflowStepDescription::name).toList()
        );
        Assertions.assertEquals("cells", workflow.stage(StageName.IMAGE_ANALYSIS).orElseThrow()
                .steps().get(0).args().get("pipeline"));
    }

    @Test
    void stageAddedAfterItsDownstreamIsAnOrderViolation() {
        WorkflowDescription workflow = new WorkflowDescription()
                .addStage(new WorkflowStageDescription(StageName.IMAGE_PREPROCESSING)
                        .addStep(WorkflowStepDescription.of(StepName.CORILLA))
                        .addStep(WorkflowStepDescription.of(StepName.ALIGN)));

        WorkflowDescriptionException ex = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> workflow.addStage(imageConversion())
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.ORDER_VIOLATION, ex.reason());
        Assertions.assertEquals(1, workflow.stages().size());
    }

    @Test
    void missingUpstreamStageIsOnlyAWarning() {
        WorkflowDescription workflow = new WorkflowDescription()
                .addStage(new WorkflowStageDescription(StageName.IMAGE_ANALYSIS)
                        .addStep(WorkflowStepDescription.of(StepName.JTERATOR)));

        Assertions.assertEquals(1, workflow.stages().size());
    }

    @Test
    void duplicateStageIsRejected() {
        WorkflowDescription workflow = new WorkflowDescription().addStage(imageConversion());

        WorkflowDescriptionException ex = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> workflow.addStage(imageConversion())
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.DUPLICATE_STAGE, ex.reason());
    }

    @Test
    void stageWithoutAllRequiredStepsIsIncomplete() {
        WorkflowStageDescription partial = new WorkflowStageDescription(StageName.IMAGE_CONVERSION)
                .addStep(WorkflowStepDescription.of(StepName.METAEXTRACT))
                .addStep(WorkflowStepDescription.of(StepName.METACONFIG));

        WorkflowDescriptionException ex = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> new WorkflowDescription().addStage(partial)
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.INCOMPLETE_STAGE, ex.reason());
    }

    @Test
    void stepBeforeItsUpstreamStepIsRejected() {
        WorkflowStageDescription stage = new WorkflowStageDescription(StageName.IMAGE_CONVERSION)
                .addStep(WorkflowStepDescription.of(StepName.METAEXTRACT));

        WorkflowDescriptionException ex = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> stage.addStep(WorkflowStepDescription.of(StepName.IMEXTRACT))
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.MISSING_UPSTREAM_STEP, ex.reason());
        Assertions.assertEquals(1, stage.steps().size());
    }

    @Test
    void stepOfAnotherStageIsUnknown() {
        WorkflowStageDescription stage = new WorkflowStageDescription(StageName.IMAGE_CONVERSION);

        WorkflowDescriptionException ex = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> stage.addStep(WorkflowStepDescription.of(StepName.JTERATOR))
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.UNKNOWN_STEP, ex.reason());
    }

    @Test
    void duplicateStepIsRejected() {
        WorkflowStageDescription stage = new WorkflowStageDescription(StageName.IMAGE_PREPROCESSING)
                .addStep(WorkflowStepDescription.of(StepName.CORILLA));

        WorkflowDescriptionException ex = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> stage.addStep(WorkflowStepDescription.of(StepName.CORILLA))
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.DUPLICATE_STEP, ex.reason());
    }

    @Test
    void unknownNamesAreRejected() {
        DependencyRegistry registry = DependencyRegistry.canonical();

        WorkflowDescriptionException stage = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> registry.validateStage("image_smoothing")
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.UNKNOWN_STAGE, stage.reason());

        WorkflowDescriptionException step = Assertions.assertThrows(
                WorkflowDescriptionException.class,
                () -> registry.validateStep("deconvolve")
        );
        Assertions.assertEquals(WorkflowDescriptionException.Reason.UNKNOWN_STEP, step.reason());
        Assertions.assertEquals(StepName.ALIGN, registry.validateStep("align", StageName.IMAGE_PREPROCESSING));
    }

    @Test
    void stageCannotChangeOnceAdded() {
        WorkflowStageDescription stage = new WorkflowStageDescription(StageName.IMAGE_PREPROCESSING)
                .addStep(WorkflowStepDescription.of(StepName.CORILLA))
                .addStep(WorkflowStepDescription.of(StepName.ALIGN));
        new WorkflowDescription().addStage(stage);

        Assertions.assertThrows(
                IllegalStateException.class,
                () -> stage.addStep(WorkflowStepDescription.of(StepName.CORILLA))
        );
    }

    private static WorkflowStageDescription imageConversion() {
        return new WorkflowStageDescription(StageName.IMAGE_CONVERSION)
                .addStep(WorkflowStepDescription.of(StepName.METAEXTRACT))
                .addStep(WorkflowStepDescription.of(StepName.METACONFIG))
                .addStep(WorkflowStepDescription.of(StepName.IMEXTRACT));
    }
}
