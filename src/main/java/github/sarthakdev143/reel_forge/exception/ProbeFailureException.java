package github.sarthakdev143.reel_forge.exception;

import github.sarthakdev143.reel_forge.model.GenerationStage;

public class ProbeFailureException extends GenerationException {

    public ProbeFailureException(String message) {
        super(null, message);
    }

    public ProbeFailureException(GenerationStage stage, String message, Throwable cause) {
        super(stage, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
