package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OutputPreset {
    LANDSCAPE_16_9("16:9", 1920, 1080),
    PORTRAIT_9_16("9:16", 1080, 1920),
    SQUARE_1_1("1:1", 1080, 1080);

    private final String aspectRatio;
    private final int width;
    private final int height;

    OutputPreset(String aspectRatio, int width, int height) {
        this.aspectRatio = aspectRatio;
        this.width = width;
        this.height = height;
    }

    @JsonValue
    public String aspectRatio() {
        return aspectRatio;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    @JsonCreator
    public static OutputPreset fromInput(String input) {
        if (input == null || input.isBlank()) {
            return LANDSCAPE_16_9;
        }

        String normalized = input.trim();
        for (OutputPreset preset : values()) {
            if (preset.aspectRatio.equals(normalized) || preset.name().equalsIgnoreCase(normalized)) {
                return preset;
            }
        }
        throw new IllegalArgumentException("aspect_ratio must be one of 16:9, 9:16, 1:1.");
    }
}
