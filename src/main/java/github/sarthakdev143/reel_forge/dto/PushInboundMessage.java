package github.sarthakdev143.reel_forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Inbound push-channel frame. {@code taskId} subscribes to an existing task; a {@code prompt} alone submits a new one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PushInboundMessage(
        String prompt,
        String taskId,
        String aspectRatio,
        Integer durationSeconds,
        String style) {

    public GenerationRequest toGenerationRequest() {
        return new GenerationRequest(prompt, aspectRatio, durationSeconds, style);
    }
}
