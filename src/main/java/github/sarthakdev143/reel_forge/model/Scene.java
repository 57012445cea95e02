package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Scene(
        int index,
        String title,
        String scriptText,
        String visualPrompt,
        String audioPrompt,
        String musicPrompt,
        double weight,
        Double targetDuration,
        Double actualDuration,
        SceneAssets assets) {

    public static final double DEFAULT_WEIGHT = 1.0;

    public Scene {
        if (index < 0) {
            throw new IllegalArgumentException("Scene index must be >= 0.");
        }
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("Scene weight must be >= 0.");
        }
        assets = assets == null ? SceneAssets.empty() : assets;
    }

    public static Scene fromOutline(int index, SceneOutline outline) {
        double weight = outline.weight() == null ? DEFAULT_WEIGHT : outline.weight();
        return new Scene(
                index,
                outline.title(),
                outline.scriptText(),
                outline.visualPrompt(),
                outline.audioPrompt(),
                outline.musicPrompt(),
                weight,
                null,
                null,
                SceneAssets.empty());
    }

    public Scene withTargetDuration(double seconds) {
        if (targetDuration != null) {
            throw new IllegalStateException("Scene " + index + " already has a target duration.");
        }
        return new Scene(index, title, scriptText, visualPrompt, audioPrompt, musicPrompt, weight,
                seconds, actualDuration, assets);
    }

    public Scene withActualDuration(double seconds) {
        return new Scene(index, title, scriptText, visualPrompt, audioPrompt, musicPrompt, weight,
                targetDuration, seconds, assets);
    }

    public Scene withAssets(SceneAssets updatedAssets) {
        return new Scene(index, title, scriptText, visualPrompt, audioPrompt, musicPrompt, weight,
                targetDuration, actualDuration, updatedAssets);
    }
}
