package github.sarthakdev143.reel_forge.exception;

/**
 * Invalid input or a request the provider permanently rejected.
 */
public class ProviderPermanentException extends GenerationException {

    public ProviderPermanentException(String message) {
        super(null, message);
    }

    public ProviderPermanentException(String message, Throwable cause) {
        super(null, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
