package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Canonical snapshot of a task's state, used both for push delivery and for status pulls.
 *
 * @param stageProgress percent of {@code stage}; 0 while the task is pending
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgressEvent(
        String taskId,
        TaskStatus status,
        GenerationStage stage,
        int stageProgress,
        int overallProgress,
        String message,
        TaskError error,
        TaskResult result) {

    public static ProgressEvent from(GenerationTaskSnapshot snapshot) {
        int currentStageProgress = snapshot.stage() == null
                ? 0
                : snapshot.stageProgress().getOrDefault(snapshot.stage().wireName(), 0);
        return new ProgressEvent(
                snapshot.id(),
                snapshot.status(),
                snapshot.stage(),
                currentStageProgress,
                snapshot.overallProgress(),
                snapshot.message(),
                snapshot.error(),
                snapshot.result());
    }

    public static ProgressEvent notFound(String taskId) {
        return new ProgressEvent(taskId, null, null, 0, 0, null, new TaskError(null, "Task not found"), null);
    }
}
