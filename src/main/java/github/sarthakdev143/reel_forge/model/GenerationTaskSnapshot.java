package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, serializable view of a {@link GenerationTask}. This is the persisted task record.
 *
 * @param stage          the stage the task is in, or was in when it reached a terminal status
 * @param stageProgress  percent per stage wire name, in pipeline order, for every stage entered so far
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerationTaskSnapshot(
        String id,
        String ownerId,
        String prompt,
        GenerationConfig config,
        TaskStatus status,
        GenerationStage stage,
        Map<String, Integer> stageProgress,
        int overallProgress,
        String message,
        TaskError error,
        TaskResult result,
        PromptAnalysis promptAnalysis,
        List<Scene> scenes,
        Instant createdAt,
        Instant updatedAt) {

    public GenerationTaskSnapshot {
        stageProgress = stageProgress == null ? Map.of() : new LinkedHashMap<>(stageProgress);
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
    }
}
