package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One scene as proposed by the scene-breakdown provider, before it is indexed and timed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneOutline(
        String title,
        String scriptText,
        String visualPrompt,
        String audioPrompt,
        String musicPrompt,
        Double weight) {
}
