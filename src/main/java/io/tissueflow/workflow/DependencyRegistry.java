package io.tissueflow.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class DependencyRegistry {
    private static final DependencyRegistry CANONICAL = new DependencyRegistry(
            canonicalStepsPerStage(),
            canonicalInterStageDependencies(),
            canonicalIntraStageDependencies()
    );

    private final Map<StageName, List<StepName>> stepsPerStage;
    private final Map<StageName, Set<StageName>> interStageDependencies;
    private final Map<StepName, Set<StepName>> intraStageDependencies;

    public DependencyRegistry(
            Map<StageName, List<StepName>> stepsPerStage,
            Map<StageName, Set<StageName>> interStageDependencies,
            Map<StepName, Set<StepName>> intraStageDependencies
    ) {
        Map<StageName, List<StepName>> steps = new LinkedHashMap<>();
        stepsPerStage.forEach((stage, list) -> steps.put(stage, List.copyOf(list)));
        Map<StageName, Set<StageName>> inter = new EnumMap<>(StageName.class);
        interStageDependencies.forEach((stage, deps) -> inter.put(stage, Set.copyOf(deps)));
        Map<StepName, Set<StepName>> intra = new EnumMap<>(StepName.class);
        intraStageDependencies.forEach((step, deps) -> intra.put(step, Set.copyOf(deps)));
        this.stepsPerStage = Collections.unmodifiableMap(steps);
        this.interStageDependencies = Collections.unmodifiableMap(inter);
        this.intraStageDependencies = Collections.unmodifiableMap(intra);
    }

    public static DependencyRegistry canonical() {
        return CANONICAL;
    }

    public StageName validateStage(String name) {
        StageName stage = StageName.fromString(name);
        if (!stepsPerStage.containsKey(stage)) {
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.UNKNOWN_STAGE,
                    "Unknown stage \"" + name + "\". Known stages are: " + stepsPerStage.keySet()
            );
        }
        return stage;
    }

    public StepName validateStep(String name) {
        return validateStep(name, null);
    }

    public StepName validateStep(String name, StageName stage) {
        StepName step = StepName.fromString(name);
        if (stage == null) {
            for (List<StepName> steps : stepsPerStage.values()) {
                if (steps.contains(step)) {
                    return step;
                }
            }
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.UNKNOWN_STEP,
                    "Unknown step \"" + name + "\""
            );
        }
        List<StepName> known = stepsOf(stage);
        if (!known.contains(step)) {
            throw new WorkflowDescriptionException(
                    WorkflowDescriptionException.Reason.UNKNOWN_STEP,
                    "Unknown step \"" + name + "\" for stage \"" + stage + "\". Known steps are: " + known
            );
        }
        return step;
    }

    public List<StepName> stepsOf(StageName stage) {
        return stepsPerStage.getOrDefault(stage, List.of());
    }

    public Set<StageName> upstreamStagesOf(StageName stage) {
        return interStageDependencies.getOrDefault(stage, Set.of());
    }

    public Set<StepName> upstreamStepsOf(StepName step) {
        return intraStageDependencies.getOrDefault(step, Set.of());
    }

    public Set<StageName> stages() {
        return stepsPerStage.keySet();
    }

    private static Map<StageName, List<StepName>> canonicalStepsPerStage() {
        Map<StageName, List<StepName>> steps = new LinkedHashMap<>();
        steps.put(StageName.IMAGE_CONVERSION, List.of(StepName.METAEXTRACT, StepName.METACONFIG, StepName.IMEXTRACT));
        steps.put(StageName.IMAGE_PREPROCESSING, List.of(StepName.CORILLA, StepName.ALIGN));
        steps.put(StageName.PYRAMID_CREATION, List.of(StepName.ILLUMINATI));
        steps.put(StageName.IMAGE_ANALYSIS, List.of(StepName.JTERATOR));
        return steps;
    }

    private static Map<StageName, Set<StageName>> canonicalInterStageDependencies() {
        Map<StageName, Set<StageName>> deps = new EnumMap<>(StageName.class);
        deps.put(StageName.IMAGE_CONVERSION, EnumSet.noneOf(StageName.class));
        deps.put(StageName.IMAGE_PREPROCESSING, EnumSet.of(StageName.IMAGE_CONVERSION));
        deps.put(StageName.PYRAMID_CREATION, EnumSet.of(StageName.IMAGE_CONVERSION, StageName.IMAGE_PREPROCESSING));
        deps.put(StageName.IMAGE_ANALYSIS, EnumSet.of(StageName.IMAGE_CONVERSION, StageName.IMAGE_PREPROCESSING));
        return deps;
    }

    private static Map<StepName, Set<StepName>> canonicalIntraStageDependencies() {
        Map<StepName, Set<StepName>> deps = new EnumMap<>(StepName.class);
        deps.put(StepName.METAEXTRACT, EnumSet.noneOf(StepName.class));
        deps.put(StepName.METACONFIG, EnumSet.of(StepName.METAEXTRACT));
        deps.put(StepName.IMEXTRACT, EnumSet.of(StepName.METACONFIG));
        return deps;
    }
}
