package github.sarthakdev143.reel_forge.exception;

/**
 * Rate limits, timeouts and upstream 5xx responses.
 */
public class ProviderTransientException extends GenerationException {

    public ProviderTransientException(String message) {
        super(null, message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(null, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
