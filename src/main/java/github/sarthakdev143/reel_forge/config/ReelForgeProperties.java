package github.sarthakdev143.reel_forge.config;

import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.StageWeightTable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

@ConfigurationProperties(prefix = "reel-forge")
public record ReelForgeProperties(
        @DefaultValue Tasks tasks,
        @DefaultValue Timing timing,
        @DefaultValue Retry retry,
        @DefaultValue Progress progress,
        Map<GenerationStage, Integer> stageWeights,
        @DefaultValue Providers providers,
        @DefaultValue Storage storage) {

    public StageWeightTable stageWeightTable() {
        if (stageWeights == null || stageWeights.isEmpty()) {
            return StageWeightTable.defaults();
        }
        return StageWeightTable.of(stageWeights);
    }

    /**
     * @param maxConcurrent     tasks running at once; further submissions wait in the queue
     * @param sceneConcurrency  per-task cap on concurrent per-scene work inside a stage
     */
    public record Tasks(
            @DefaultValue("2") int maxConcurrent,
            @DefaultValue("3") int sceneConcurrency) {
    }

    public record Timing(
            @DefaultValue("3.0") double minSceneDurationSeconds,
            @DefaultValue("2") int precisionDecimals,
            @DefaultValue("0.05") double epsilonSeconds,
            @DefaultValue("3") int maxCorrectivePasses) {
    }

    public record Retry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1s") Duration initialDelay,
            @DefaultValue("20s") Duration maxDelay,
            @DefaultValue("2.0") double multiplier,
            @DefaultValue("0.1") double jitterFactor) {
    }

    public record Progress(
            @DefaultValue("5m") Duration terminalCacheTtl,
            @DefaultValue("2s") Duration pollInterval,
            @DefaultValue("10m") Duration idleSubscriptionTimeout) {
    }

    public record Providers(
            @DefaultValue("http://localhost:8090") String baseUrl,
            @DefaultValue("5s") Duration connectTimeout,
            @DefaultValue("120s") Duration readTimeout) {
    }

    public record Storage(
            @DefaultValue("data/assets") String root) {
    }
}
