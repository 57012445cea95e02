package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerationConfig(
        OutputPreset aspectRatio,
        double totalDurationSeconds,
        String style) {

    public GenerationConfig {
        aspectRatio = aspectRatio == null ? OutputPreset.LANDSCAPE_16_9 : aspectRatio;
        if (!(totalDurationSeconds > 0)) {
            throw new IllegalArgumentException("totalDurationSeconds must be positive.");
        }
    }
}
