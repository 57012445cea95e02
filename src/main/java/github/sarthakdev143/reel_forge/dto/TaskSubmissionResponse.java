package github.sarthakdev143.reel_forge.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import github.sarthakdev143.reel_forge.model.TaskStatus;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskSubmissionResponse(
        String taskId,
        TaskStatus status,
        String message) {
}
