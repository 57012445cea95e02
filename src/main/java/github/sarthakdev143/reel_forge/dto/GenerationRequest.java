package github.sarthakdev143.reel_forge.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerationRequest(
        String prompt,
        String aspectRatio,
        Integer durationSeconds,
        String style) {
}
