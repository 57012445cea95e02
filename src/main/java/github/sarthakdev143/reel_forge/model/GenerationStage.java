package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed, ordered pipeline a generation task walks through. Declaration order is execution order.
 */
public enum GenerationStage {
    ANALYZING_PROMPT,
    GENERATING_SCENES,
    GENERATING_IMAGES,
    GENERATING_AUDIO,
    GENERATING_MUSIC,
    ASSEMBLING_VIDEO;

    public static GenerationStage first() {
        return values()[0];
    }

    public Optional<GenerationStage> next() {
        int nextOrdinal = ordinal() + 1;
        if (nextOrdinal >= values().length) {
            return Optional.empty();
        }
        return Optional.of(values()[nextOrdinal]);
    }

    public Optional<GenerationStage> previous() {
        if (ordinal() == 0) {
            return Optional.empty();
        }
        return Optional.of(values()[ordinal() - 1]);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GenerationStage fromWireName(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("stage is required.");
        }
        try {
            return GenerationStage.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown generation stage: " + input);
        }
    }
}
