package github.sarthakdev143.reel_forge.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationTaskTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private GenerationTask task;

    @BeforeEach
    void setUp() {
        task = GenerationTask.create(
                "owner-1",
                "A sunrise over mountains",
                new GenerationConfig(OutputPreset.LANDSCAPE_16_9, 30, null),
                StageWeightTable.defaults(),
                clock);
    }

    @Test
    void startsPendingWithZeroProgress() {
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.stage()).isNull();
        assertThat(task.overallProgress()).isZero();
        assertThat(task.snapshot().message()).isEqualTo("Task queued.");
    }

    @Test
    void walksEveryStageInOrderAndCompletes() {
        int lastOverall = task.overallProgress();
        for (GenerationStage stage : GenerationStage.values()) {
            task.enterStage(stage);
            assertThat(task.status()).isEqualTo(TaskStatus.forStage(stage));
            assertThat(task.stageProgress(stage)).isZero();
            assertThat(task.overallProgress()).isGreaterThanOrEqualTo(lastOverall);

            task.reportStageProgress(40);
            assertThat(task.overallProgress()).isGreaterThanOrEqualTo(lastOverall);
            task.reportStageProgress(100);
            assertThat(task.overallProgress()).isGreaterThanOrEqualTo(lastOverall);
            lastOverall = task.overallProgress();
        }

        task.complete(new TaskResult(new AssetRef("local:video"), new AssetRef("local:thumb")));

        GenerationTaskSnapshot snapshot = task.snapshot();
        assertThat(snapshot.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(snapshot.overallProgress()).isEqualTo(100);
        assertThat(snapshot.stageProgress()).hasSize(GenerationStage.values().length).containsValue(100);
        assertThat(snapshot.error()).isNull();
    }

    @Test
    void cannotSkipAStage() {
        task.enterStage(GenerationStage.ANALYZING_PROMPT);
        task.reportStageProgress(100);

        assertThatThrownBy(() -> task.enterStage(GenerationStage.GENERATING_IMAGES))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot move from analyzing_prompt to generating_images");
    }

    @Test
    void mustStartWithFirstStage() {
        assertThatThrownBy(() -> task.enterStage(GenerationStage.GENERATING_SCENES))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cannotLeaveStageBeforeItReportsHundred() {
        task.enterStage(GenerationStage.ANALYZING_PROMPT);
        task.reportStageProgress(99);

        assertThatThrownBy(() -> task.enterStage(GenerationStage.GENERATING_SCENES))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("100%");
    }

    @Test
    void stageProgressNeverRegresses() {
        task.enterStage(GenerationStage.ANALYZING_PROMPT);

        assertThat(task.reportStageProgress(60)).isTrue();
        assertThat(task.reportStageProgress(30)).isFalse();
        assertThat(task.stageProgress(GenerationStage.ANALYZING_PROMPT)).isEqualTo(60);
    }

    @Test
    void failureIsTerminalAndRecordsStage() {
        task.enterStage(GenerationStage.ANALYZING_PROMPT);
        task.fail(GenerationStage.ANALYZING_PROMPT, "analyzing_prompt failed: rejected");

        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.snapshot().error()).isEqualTo(new TaskError(GenerationStage.ANALYZING_PROMPT, "analyzing_prompt failed: rejected"));
        assertThatThrownBy(() -> task.reportStageProgress(100)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> task.fail(GenerationStage.ANALYZING_PROMPT, "again")).isInstanceOf(IllegalStateException.class);
        assertThat(task.cancel()).isFalse();
    }

    @Test
    void cancelLeavesNoError() {
        task.enterStage(GenerationStage.ANALYZING_PROMPT);

        assertThat(task.cancel()).isTrue();
        assertThat(task.status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(task.snapshot().error()).isNull();
        assertThatThrownBy(() -> task.enterStage(GenerationStage.GENERATING_SCENES)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void scenesAreAssignedOnceAndUpdatedPerIndex() {
        task.enterStage(GenerationStage.ANALYZING_PROMPT);
        task.reportStageProgress(100);
        task.enterStage(GenerationStage.GENERATING_SCENES);

        Scene first = Scene.fromOutline(0, new SceneOutline("One", "text", "visual", null, null, null));
        Scene second = Scene.fromOutline(1, new SceneOutline("Two", "text", "visual", null, null, 2.0));
        task.assignScenes(List.of(first, second));

        assertThatThrownBy(() -> task.assignScenes(List.of(first))).isInstanceOf(IllegalStateException.class);

        task.updateScene(1, scene -> scene.withAssets(scene.assets().withImage(new AssetRef("local:img"))));
        assertThat(task.scene(1).assets().image()).isEqualTo(new AssetRef("local:img"));
        assertThat(task.scene(0).assets().image()).isNull();
        assertThat(task.scene(1).weight()).isEqualTo(2.0);
        assertThat(task.scene(0).weight()).isEqualTo(Scene.DEFAULT_WEIGHT);
    }

    @Test
    void restoredTaskMatchesOriginalSnapshot() {
        task.enterStage(GenerationStage.ANALYZING_PROMPT);
        task.reportStageProgress(50);
        GenerationTaskSnapshot original = task.snapshot();

        GenerationTask restored = GenerationTask.restore(original, StageWeightTable.defaults(), clock);

        assertThat(restored.snapshot()).isEqualTo(original);
    }
}
