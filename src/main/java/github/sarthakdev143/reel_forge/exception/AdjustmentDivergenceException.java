package github.sarthakdev143.reel_forge.exception;

/**
 * Duration adjustment could not land within tolerance of the target after the allowed corrective passes.
 */
public class AdjustmentDivergenceException extends GenerationException {

    public AdjustmentDivergenceException(String message) {
        super(null, message);
    }

    public AdjustmentDivergenceException(String message, Throwable cause) {
        super(null, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
