package github.sarthakdev143.reel_forge.exception;

import github.sarthakdev143.reel_forge.model.GenerationStage;

/**
 * Base type for every failure raised while driving a generation task.
 */
public abstract class GenerationException extends RuntimeException {

    private final GenerationStage stage;

    protected GenerationException(GenerationStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected GenerationException(GenerationStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /**
     * @return the stage the failure originated in, or {@code null} when raised outside a stage
     */
    public GenerationStage getStage() {
        return stage;
    }

    /**
     * Transient failures are retried with backoff inside the stage before they fail the task.
     */
    public abstract boolean isRetryable();
}
