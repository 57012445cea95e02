package github.sarthakdev143.reel_forge.service.impl;

import github.sarthakdev143.reel_forge.dto.GenerationRequest;
import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.OutputPreset;
import org.springframework.stereotype.Component;

/**
 * Validates client submissions and turns them into a {@link GenerationConfig}. Failures are
 * {@link IllegalArgumentException}s with a client-facing message.
 */
@Component
public class GenerationRequestValidator {

    static final int MAX_PROMPT_LENGTH = 4000;
    static final int MIN_DURATION_SECONDS = 5;
    static final int MAX_DURATION_SECONDS = 600;
    static final int DEFAULT_DURATION_SECONDS = 30;
    static final int MAX_STYLE_LENGTH = 100;
    static final int MAX_OWNER_ID_LENGTH = 128;

    public String validateOwnerId(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id is required.");
        }
        String normalized = ownerId.trim();
        if (normalized.length() > MAX_OWNER_ID_LENGTH) {
            throw new IllegalArgumentException("Owner id must be at most " + MAX_OWNER_ID_LENGTH + " characters.");
        }
        return normalized;
    }

    public String validatePrompt(GenerationRequest request) {
        if (request == null || request.prompt() == null || request.prompt().isBlank()) {
            throw new IllegalArgumentException("prompt is required.");
        }
        String prompt = request.prompt().trim();
        if (prompt.length() > MAX_PROMPT_LENGTH) {
            throw new IllegalArgumentException("prompt must be at most " + MAX_PROMPT_LENGTH + " characters.");
        }
        return prompt;
    }

    public GenerationConfig toConfig(GenerationRequest request) {
        int duration = request.durationSeconds() == null ? DEFAULT_DURATION_SECONDS : request.durationSeconds();
        if (duration < MIN_DURATION_SECONDS || duration > MAX_DURATION_SECONDS) {
            throw new IllegalArgumentException(
                    "duration_seconds must be between " + MIN_DURATION_SECONDS + " and " + MAX_DURATION_SECONDS + ".");
        }

        String style = request.style() == null || request.style().isBlank() ? null : request.style().trim();
        if (style != null && style.length() > MAX_STYLE_LENGTH) {
            throw new IllegalArgumentException("style must be at most " + MAX_STYLE_LENGTH + " characters.");
        }

        return new GenerationConfig(OutputPreset.fromInput(request.aspectRatio()), duration, style);
    }
}
