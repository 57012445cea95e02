package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.exception.GenerationException;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retries retryable {@link GenerationException}s inside a stage with bounded exponential backoff and jitter.
 * Anything else, and the last failure once attempts run out, propagates unchanged.
 */
@Component
public class StageRetrier {

    private static final Logger logger = LoggerFactory.getLogger(StageRetrier.class);

    private final ReelForgeProperties.Retry policy;
    private final MeterRegistry meterRegistry;

    public StageRetrier(ReelForgeProperties properties, MeterRegistry meterRegistry) {
        this.policy = properties.retry();
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(GenerationStage stage, CancellationSignal cancellation, String operation, Supplier<T> call) {
        int maxAttempts = Math.max(1, policy.maxAttempts());
        int attempt = 1;
        while (true) {
            cancellation.throwIfCancelled();
            try {
                return call.get();
            } catch (GenerationException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }

                Duration delay = delayBeforeRetry(attempt);
                logger.warn("{} failed during {} (attempt {}/{}), retrying in {} ms: {}",
                        operation, stage.wireName(), attempt, maxAttempts, delay.toMillis(), e.getMessage());
                meterRegistry.counter("reel_forge.provider.retries", "stage", stage.wireName()).increment();
                cancellation.sleep(delay);
                attempt++;
            }
        }
    }

    /**
     * initialDelay * multiplier^(attempt-1), capped at maxDelay, then spread by +/- jitterFactor.
     */
    Duration delayBeforeRetry(int attempt) {
        double baseMillis = policy.initialDelay().toMillis() * Math.pow(policy.multiplier(), attempt - 1);
        double cappedMillis = Math.min(baseMillis, policy.maxDelay().toMillis());
        double jitter = policy.jitterFactor() <= 0
                ? 0
                : cappedMillis * policy.jitterFactor() * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        return Duration.ofMillis(Math.max(0, Math.round(cappedMillis + jitter)));
    }
}
