package github.sarthakdev143.reel_forge.exception;

import github.sarthakdev143.reel_forge.model.GenerationStage;

/**
 * A media tool or asset store failed while processing a stage's assets.
 */
public class MediaProcessingException extends GenerationException {

    public MediaProcessingException(GenerationStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
