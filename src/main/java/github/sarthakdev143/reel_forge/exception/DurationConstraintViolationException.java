package github.sarthakdev143.reel_forge.exception;

import github.sarthakdev143.reel_forge.model.GenerationStage;

/**
 * The requested total duration cannot honor the per-scene minimum.
 */
public class DurationConstraintViolationException extends GenerationException {

    public DurationConstraintViolationException(String message) {
        super(GenerationStage.GENERATING_SCENES, message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
