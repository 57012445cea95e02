package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.exception.DurationConstraintViolationException;
import github.sarthakdev143.reel_forge.model.Scene;
import github.sarthakdev143.reel_forge.model.SceneOutline;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SceneDurationAllocatorTest {

    private final SceneDurationAllocator allocator = new SceneDurationAllocator(3.0, 2);

    @Test
    void equalWeightsSplitEvenly() {
        List<Double> targets = allocator.allocate(List.of(1.0, 1.0, 1.0), 30);

        assertThat(targets).containsExactly(10.0, 10.0, 10.0);
    }

    @Test
    void heavyFirstSceneLeavesOthersAtTheFloor() {
        List<Double> targets = allocator.allocate(List.of(5.0, 1.0, 1.0), 21);

        assertThat(targets).containsExactly(15.0, 3.0, 3.0);
        assertThat(sum(targets)).isCloseTo(21.0, within(1e-9));
    }

    @Test
    void clampedScenesPushRemainderToOthersUntilStable() {
        // Raw shares are 16, 2, 2; clamping both small scenes leaves 14 for the first.
        List<Double> targets = allocator.allocate(List.of(8.0, 1.0, 1.0), 20);

        assertThat(targets).containsExactly(14.0, 3.0, 3.0);
    }

    @Test
    void iteratesWhenRedistributionCreatesNewViolations() {
        // Raw shares 14.29, 4.29, 1.43: only the last scene is clamped at first, which drops the middle one to 3.69.
        SceneDurationAllocator allocator = new SceneDurationAllocator(4.0, 2);

        List<Double> targets = allocator.allocate(List.of(10.0, 3.0, 1.0), 20);

        assertThat(targets).containsExactly(12.0, 4.0, 4.0);
    }

    @Test
    void singleSceneGetsEverything() {
        assertThat(allocator.allocate(List.of(0.2), 17.5)).containsExactly(17.5);
    }

    @Test
    void zeroWeightSceneGetsExactlyTheMinimum() {
        List<Double> targets = allocator.allocate(List.of(1.0, 0.0, 1.0), 30);

        assertThat(targets).containsExactly(13.5, 3.0, 13.5);
    }

    @Test
    void allZeroWeightsAreTreatedAsUniform() {
        assertThat(allocator.allocate(List.of(0.0, 0.0), 12)).containsExactly(6.0, 6.0);
    }

    @Test
    void lastSceneAbsorbsRoundingResidual() {
        List<Double> targets = allocator.allocate(List.of(1.0, 1.0, 1.0), 10);

        assertThat(targets).containsExactly(3.33, 3.33, 3.34);
    }

    @Test
    void zeroWeightLastSceneKeepsMinimumWhenEarlierScenesRoundUp() {
        // Free shares are 3.505 each; rounding both up would leave 2.99 for the last scene.
        List<Double> targets = allocator.allocate(List.of(1.0, 1.0, 0.0), 10.01);

        assertThat(targets).containsExactly(3.5, 3.51, 3.0);
        assertThat(sum(targets)).isCloseTo(10.01, within(1e-9));
    }

    @Test
    void totalFinerThanPrecisionNeverLeavesLastSceneUnderMinimum() {
        List<Double> targets = allocator.allocate(List.of(1.0, 1.0, 1.0), 9.015);

        assertThat(targets).hasSize(3).allSatisfy(target -> assertThat(target).isGreaterThanOrEqualTo(3.0));
        assertThat(sum(targets)).isCloseTo(9.015, within(1e-9));
    }

    @Test
    void failsWhenMinimumCannotBeHonored() {
        assertThatThrownBy(() -> allocator.allocate(List.of(1.0, 1.0, 1.0, 1.0), 11))
                .isInstanceOf(DurationConstraintViolationException.class)
                .hasMessageContaining("4 scenes");
    }

    @Test
    void rejectsNegativeWeights() {
        assertThatThrownBy(() -> allocator.allocate(List.of(1.0, -1.0), 30))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exactlyFeasibleTotalGivesEveryoneTheMinimum() {
        assertThat(allocator.allocate(List.of(9.0, 1.0, 1.0), 9)).containsExactly(3.0, 3.0, 3.0);
    }

    @Test
    void randomFeasibleInputsSumToTotalAndRespectFloor() {
        Random random = new Random(42);
        for (int round = 0; round < 500; round++) {
            int count = 1 + random.nextInt(10);
            double min = random.nextInt(5);
            double total = Math.round((min * count + random.nextDouble() * 120 + 0.5) * 100) / 100.0;
            List<Double> weights = new ArrayList<>();
            for (int index = 0; index < count; index++) {
                weights.add(random.nextInt(4) == 0 ? 0.0 : random.nextDouble() * 10);
            }

            SceneDurationAllocator randomized = new SceneDurationAllocator(min, 2);
            List<Double> targets = randomized.allocate(weights, total);

            assertThat(targets).hasSize(count);
            assertThat(sum(targets)).isCloseTo(total, within(1e-6));
            for (double target : targets) {
                assertThat(target).isGreaterThanOrEqualTo(min);
            }
            assertThat(randomized.allocate(weights, total)).isEqualTo(targets);
        }
    }

    @Test
    void assignTargetsSetsSceneDurations() {
        List<Scene> scenes = List.of(
                Scene.fromOutline(0, new SceneOutline("a", "x", "v", null, null, 5.0)),
                Scene.fromOutline(1, new SceneOutline("b", "x", "v", null, null, 1.0)),
                Scene.fromOutline(2, new SceneOutline("c", "x", "v", null, null, 1.0)));

        List<Scene> timed = allocator.assignTargets(scenes, 21);

        assertThat(timed).extracting(Scene::targetDuration).containsExactly(15.0, 3.0, 3.0);
        assertThat(timed).extracting(Scene::index).containsExactly(0, 1, 2);
    }

    private static double sum(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).sum();
    }
}
