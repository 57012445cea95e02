package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    PENDING(null),
    ANALYZING_PROMPT(GenerationStage.ANALYZING_PROMPT),
    GENERATING_SCENES(GenerationStage.GENERATING_SCENES),
    GENERATING_IMAGES(GenerationStage.GENERATING_IMAGES),
    GENERATING_AUDIO(GenerationStage.GENERATING_AUDIO),
    GENERATING_MUSIC(GenerationStage.GENERATING_MUSIC),
    ASSEMBLING_VIDEO(GenerationStage.ASSEMBLING_VIDEO),
    COMPLETED(null),
    FAILED(null),
    CANCELLED(null);

    private final GenerationStage stage;

    TaskStatus(GenerationStage stage) {
        this.stage = stage;
    }

    /**
     * @return the stage this status represents, or {@code null} for pending and terminal statuses
     */
    public GenerationStage stage() {
        return stage;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static TaskStatus forStage(GenerationStage stage) {
        for (TaskStatus status : values()) {
            if (status.stage == stage && stage != null) {
                return status;
            }
        }
        throw new IllegalArgumentException("No status for stage " + stage);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWireName(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("status is required.");
        }
        try {
            return TaskStatus.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown task status: " + input);
        }
    }
}
