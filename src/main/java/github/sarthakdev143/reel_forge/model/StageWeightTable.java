package github.sarthakdev143.reel_forge.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static per-stage cost weights used to derive overall progress. Weights must cover every stage and sum to 100.
 */
public final class StageWeightTable {

    private static final int TOTAL_WEIGHT = 100;

    private final Map<GenerationStage, Integer> weights;

    private StageWeightTable(Map<GenerationStage, Integer> weights) {
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    public static StageWeightTable of(Map<GenerationStage, Integer> weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Stage weights are required.");
        }

        int sum = 0;
        for (GenerationStage stage : GenerationStage.values()) {
            Integer weight = weights.get(stage);
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("Stage weight for " + stage.wireName() + " must be a non-negative integer.");
            }
            sum += weight;
        }
        if (sum != TOTAL_WEIGHT) {
            throw new IllegalArgumentException("Stage weights must sum to " + TOTAL_WEIGHT + " but were " + sum + ".");
        }
        return new StageWeightTable(weights);
    }

    public static StageWeightTable defaults() {
        Map<GenerationStage, Integer> weights = new EnumMap<>(GenerationStage.class);
        weights.put(GenerationStage.ANALYZING_PROMPT, 5);
        weights.put(GenerationStage.GENERATING_SCENES, 10);
        weights.put(GenerationStage.GENERATING_IMAGES, 25);
        weights.put(GenerationStage.GENERATING_AUDIO, 20);
        weights.put(GenerationStage.GENERATING_MUSIC, 10);
        weights.put(GenerationStage.ASSEMBLING_VIDEO, 30);
        return of(weights);
    }

    public int weightOf(GenerationStage stage) {
        return weights.get(stage);
    }

    /**
     * Weighted sum of stage percentages, floored to an integer in [0, 100]. Stages absent from the map count as 0%.
     */
    public int overallProgress(Map<GenerationStage, Integer> stageProgress) {
        long weighted = 0;
        for (Map.Entry<GenerationStage, Integer> entry : stageProgress.entrySet()) {
            int percent = Math.max(0, Math.min(100, entry.getValue()));
            weighted += (long) weights.get(entry.getKey()) * percent;
        }
        return (int) Math.min(100, weighted / TOTAL_WEIGHT);
    }

    public Map<GenerationStage, Integer> asMap() {
        return weights;
    }
}
