package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.exception.DurationConstraintViolationException;
import github.sarthakdev143.reel_forge.model.Scene;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Splits a task's total duration across its scenes by weight, never giving a scene less than the configured minimum.
 * <p>
 * Scenes whose proportional share falls under the minimum are clamped to it and the remainder is re-shared among the
 * other scenes, repeating until no further scene is clamped. Results are rounded to a fixed precision and the last
 * scene absorbs the rounding residual so the targets always sum to the total. When that residual would leave the last
 * scene under the minimum, the difference is taken back from the longest earlier scenes.
 */
@Component
public class SceneDurationAllocator {

    private static final double FEASIBILITY_TOLERANCE = 1e-9;

    private final double minSceneDurationSeconds;
    private final int precisionDecimals;

    @Autowired
    public SceneDurationAllocator(ReelForgeProperties properties) {
        this(properties.timing().minSceneDurationSeconds(), properties.timing().precisionDecimals());
    }

    public SceneDurationAllocator(double minSceneDurationSeconds, int precisionDecimals) {
        if (minSceneDurationSeconds < 0) {
            throw new IllegalArgumentException("Minimum scene duration must be >= 0.");
        }
        if (precisionDecimals < 0) {
            throw new IllegalArgumentException("Precision must be >= 0 decimals.");
        }
        this.minSceneDurationSeconds = minSceneDurationSeconds;
        this.precisionDecimals = precisionDecimals;
    }

    public double minSceneDurationSeconds() {
        return minSceneDurationSeconds;
    }

    /**
     * Returns the scenes, in order, with their target durations set.
     */
    public List<Scene> assignTargets(List<Scene> scenes, double totalDurationSeconds) {
        List<Double> weights = new ArrayList<>(scenes.size());
        for (Scene scene : scenes) {
            weights.add(scene.weight());
        }

        List<Double> targets = allocate(weights, totalDurationSeconds);
        List<Scene> timed = new ArrayList<>(scenes.size());
        for (int index = 0; index < scenes.size(); index++) {
            timed.add(scenes.get(index).withTargetDuration(targets.get(index)));
        }
        return timed;
    }

    public List<Double> allocate(List<Double> weights, double totalDurationSeconds) {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("At least one scene is required.");
        }
        if (!(totalDurationSeconds > 0) || Double.isInfinite(totalDurationSeconds)) {
            throw new IllegalArgumentException("Total duration must be a positive number of seconds.");
        }

        int count = weights.size();
        if (minSceneDurationSeconds * count > totalDurationSeconds + FEASIBILITY_TOLERANCE) {
            throw new DurationConstraintViolationException(String.format(
                    "%d scenes need at least %.2fs each but the video is only %.2fs long.",
                    count, minSceneDurationSeconds, totalDurationSeconds));
        }

        double[] effectiveWeights = normalizedWeights(weights);
        double[] shares = waterFill(effectiveWeights, totalDurationSeconds);
        return roundWithResidual(shares, totalDurationSeconds);
    }

    private double[] normalizedWeights(List<Double> weights) {
        double[] result = new double[weights.size()];
        double sum = 0;
        for (int index = 0; index < result.length; index++) {
            Double weight = weights.get(index);
            if (weight == null || Double.isNaN(weight) || weight < 0 || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Scene weight at position " + index + " must be a finite number >= 0.");
            }
            result[index] = weight;
            sum += weight;
        }
        if (sum == 0) {
            Arrays.fill(result, 1.0);
        }
        return result;
    }

    private double[] waterFill(double[] weights, double total) {
        int count = weights.length;
        boolean[] fixed = new boolean[count];
        double[] shares = new double[count];
        int fixedCount = 0;

        // Each round either clamps at least one more scene or stops, so this runs at most count + 1 times.
        boolean clampedAny = true;
        while (clampedAny) {
            clampedAny = false;
            double remaining = total - fixedCount * minSceneDurationSeconds;
            double freeWeight = 0;
            int freeCount = 0;
            for (int index = 0; index < count; index++) {
                if (!fixed[index]) {
                    freeWeight += weights[index];
                    freeCount++;
                }
            }
            if (freeCount == 0) {
                break;
            }

            boolean[] clampedThisRound = new boolean[count];
            for (int index = 0; index < count; index++) {
                if (fixed[index]) {
                    shares[index] = minSceneDurationSeconds;
                    continue;
                }
                double share = freeWeight > 0
                        ? weights[index] / freeWeight * remaining
                        : remaining / freeCount;
                shares[index] = share;
                if (share < minSceneDurationSeconds) {
                    clampedThisRound[index] = true;
                    clampedAny = true;
                }
            }
            for (int index = 0; index < count; index++) {
                if (clampedThisRound[index]) {
                    fixed[index] = true;
                    shares[index] = minSceneDurationSeconds;
                    fixedCount++;
                }
            }
        }
        return shares;
    }

    private List<Double> roundWithResidual(double[] shares, double total) {
        BigDecimal minimum = BigDecimal.valueOf(minSceneDurationSeconds);
        int last = shares.length - 1;
        BigDecimal[] rounded = new BigDecimal[last];
        BigDecimal assigned = BigDecimal.ZERO;
        for (int index = 0; index < last; index++) {
            BigDecimal value = BigDecimal.valueOf(shares[index]).setScale(precisionDecimals, RoundingMode.HALF_UP);
            if (value.compareTo(minimum) < 0) {
                value = minimum;
            }
            rounded[index] = value;
            assigned = assigned.add(value);
        }

        BigDecimal residual = BigDecimal.valueOf(total).subtract(assigned);
        if (residual.compareTo(minimum) < 0) {
            reclaimShortfall(rounded, minimum.subtract(residual), minimum);
        }

        List<Double> targets = new ArrayList<>(shares.length);
        BigDecimal reassigned = BigDecimal.ZERO;
        for (BigDecimal value : rounded) {
            reassigned = reassigned.add(value);
            targets.add(value.doubleValue());
        }
        targets.add(BigDecimal.valueOf(total).subtract(reassigned).doubleValue());
        return Collections.unmodifiableList(targets);
    }

    /**
     * Moves duration back to the last scene, one precision unit at a time from the longest earlier scene, without
     * taking any earlier scene below the minimum. Feasibility guarantees the earlier scenes hold enough above it.
     */
    private void reclaimShortfall(BigDecimal[] rounded, BigDecimal shortfall, BigDecimal minimum) {
        BigDecimal unit = BigDecimal.ONE.movePointLeft(precisionDecimals);
        BigDecimal missing = shortfall;
        while (missing.signum() > 0) {
            int longest = -1;
            for (int index = 0; index < rounded.length; index++) {
                if (longest < 0 || rounded[index].compareTo(rounded[longest]) > 0) {
                    longest = index;
                }
            }
            BigDecimal spare = longest < 0 ? BigDecimal.ZERO : rounded[longest].subtract(minimum);
            if (spare.signum() <= 0) {
                throw new DurationConstraintViolationException(
                        "Scenes cannot all keep the minimum duration after rounding to " + precisionDecimals + " decimals.");
            }
            BigDecimal taken = unit.min(spare);
            rounded[longest] = rounded[longest].subtract(taken);
            missing = missing.subtract(taken);
        }
    }
}
