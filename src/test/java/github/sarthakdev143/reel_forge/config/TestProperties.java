package github.sarthakdev143.reel_forge.config;

import java.time.Duration;

/**
 * Builds {@link ReelForgeProperties} for unit tests without a Spring context.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static ReelForgeProperties defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private ReelForgeProperties.Tasks tasks = new ReelForgeProperties.Tasks(2, 3);
        private ReelForgeProperties.Timing timing = new ReelForgeProperties.Timing(3.0, 2, 0.05, 3);
        private ReelForgeProperties.Retry retry = new ReelForgeProperties.Retry(
                3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, 0.0);
        private ReelForgeProperties.Progress progress = new ReelForgeProperties.Progress(
                Duration.ofMinutes(5), Duration.ofSeconds(2), Duration.ofMinutes(10));
        private ReelForgeProperties.Providers providers = new ReelForgeProperties.Providers(
                "http://provider.test", Duration.ofSeconds(1), Duration.ofSeconds(5));
        private ReelForgeProperties.Storage storage = new ReelForgeProperties.Storage("target/test-assets");

        public Builder tasks(int maxConcurrent, int sceneConcurrency) {
            this.tasks = new ReelForgeProperties.Tasks(maxConcurrent, sceneConcurrency);
            return this;
        }

        public Builder retry(ReelForgeProperties.Retry retry) {
            this.retry = retry;
            return this;
        }

        public Builder storageRoot(String root) {
            this.storage = new ReelForgeProperties.Storage(root);
            return this;
        }

        public ReelForgeProperties build() {
            return new ReelForgeProperties(tasks, timing, retry, progress, null, providers, storage);
        }
    }
}
