package io.tissueflow.workflow;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.tissueflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

public final class WorkflowDescriptionLoader {
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private WorkflowDescriptionLoader() {
    }

    public static WorkflowDescription load(Path file) throws IOException {
        return parse(Jsons.mapper().readTree(file.toFile()), DependencyRegistry.canonical());
    }

    public static WorkflowDescription loadFromString(String json) throws IOException {
        return parse(Jsons.mapper().readTree(json), DependencyRegistry.canonical());
    }

    static WorkflowDescription parse(JsonNode root, DependencyRegistry registry) {
        WorkflowDescription description = new WorkflowDescription(registry);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Workflow description must be a JSON object");
        }
        for (JsonNode stageNode : root.path("stages")) {
            StageName stageName = registry.validateStage(stageNode.path("name").asText(""));
            WorkflowStageDescription stage = new WorkflowStageDescription(stageName, registry);
            for (JsonNode stepNode : stageNode.path("steps")) {
                StepName stepName = registry.validateStep(stepNode.path("name").asText(""), stageName);
                Map<String, Object> args = stepNode.has("args")
                        ? Jsons.mapper().convertValue(stepNode.get("args"), ARGS_TYPE)
                        : Map.of();
                stage.addStep(new WorkflowStepDescription(stepName, args));
            }
            description.addStage(stage);
        }
        return description;
    }
}
