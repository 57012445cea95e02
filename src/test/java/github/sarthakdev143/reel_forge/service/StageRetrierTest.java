package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.config.TestProperties;
import github.sarthakdev143.reel_forge.exception.ProviderPermanentException;
import github.sarthakdev143.reel_forge.exception.ProviderTransientException;
import github.sarthakdev143.reel_forge.exception.TaskCancelledException;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageRetrierTest {

    private SimpleMeterRegistry meterRegistry;
    private StageRetrier retrier;
    private CancellationSignal cancellation;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        retrier = new StageRetrier(TestProperties.defaults(), meterRegistry);
        cancellation = new CancellationSignal("task-1");
    }

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = retrier.execute(GenerationStage.GENERATING_IMAGES, cancellation, "image", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ProviderTransientException("429 Too Many Requests");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(meterRegistry.counter("reel_forge.provider.retries", "stage", "generating_images").count())
                .isEqualTo(2.0);
    }

    @Test
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute(GenerationStage.GENERATING_AUDIO, cancellation, "speech", () -> {
            calls.incrementAndGet();
            throw new ProviderPermanentException("400 Bad Request");
        })).isInstanceOf(ProviderPermanentException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void rethrowsLastTransientFailureWhenAttemptsRunOut() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute(GenerationStage.GENERATING_MUSIC, cancellation, "music", () -> {
            throw new ProviderTransientException("503 attempt " + calls.incrementAndGet());
        })).isInstanceOf(ProviderTransientException.class).hasMessage("503 attempt 3");
    }

    @Test
    void stopsRetryingOnceCancelled() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute(GenerationStage.GENERATING_IMAGES, cancellation, "image", () -> {
            calls.incrementAndGet();
            cancellation.cancel();
            throw new ProviderTransientException("timeout");
        })).isInstanceOf(TaskCancelledException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void backoffGrowsExponentiallyAndIsCapped() {
        ReelForgeProperties properties = TestProperties.builder()
                .retry(new ReelForgeProperties.Retry(5, Duration.ofSeconds(1), Duration.ofSeconds(3), 2.0, 0.0))
                .build();
        StageRetrier noJitter = new StageRetrier(properties, meterRegistry);

        assertThat(noJitter.delayBeforeRetry(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(noJitter.delayBeforeRetry(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(noJitter.delayBeforeRetry(3)).isEqualTo(Duration.ofSeconds(3));
        assertThat(noJitter.delayBeforeRetry(4)).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void jitterStaysWithinConfiguredFactor() {
        ReelForgeProperties properties = TestProperties.builder()
                .retry(new ReelForgeProperties.Retry(5, Duration.ofSeconds(1), Duration.ofSeconds(20), 2.0, 0.1))
                .build();
        StageRetrier jittered = new StageRetrier(properties, meterRegistry);

        for (int i = 0; i < 100; i++) {
            assertThat(jittered.delayBeforeRetry(2).toMillis()).isBetween(1800L, 2200L);
        }
    }
}
