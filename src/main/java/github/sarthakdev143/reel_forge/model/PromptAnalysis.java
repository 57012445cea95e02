package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PromptAnalysis(
        String title,
        String summary,
        String style,
        String tone,
        int suggestedSceneCount) {
}
