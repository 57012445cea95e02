package github.sarthakdev143.reel_forge.service.impl;

import github.sarthakdev143.reel_forge.exception.ProviderPermanentException;
import github.sarthakdev143.reel_forge.exception.TaskNotFoundException;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.OutputPreset;
import github.sarthakdev143.reel_forge.model.ProgressEvent;
import github.sarthakdev143.reel_forge.model.Scene;
import github.sarthakdev143.reel_forge.model.StageWeightTable;
import github.sarthakdev143.reel_forge.model.TaskResult;
import github.sarthakdev143.reel_forge.model.TaskStatus;
import github.sarthakdev143.reel_forge.repository.InMemoryTaskStore;
import github.sarthakdev143.reel_forge.service.ProgressBus;
import github.sarthakdev143.reel_forge.service.RecordingSubscriber;
import github.sarthakdev143.reel_forge.service.TaskContext;
import github.sarthakdev143.reel_forge.service.stage.StageHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskRunnerTest {

    private static final GenerationConfig CONFIG = new GenerationConfig(OutputPreset.PORTRAIT_9_16, 20, "cinematic");
    private static final TaskResult RESULT = new TaskResult(new AssetRef("local:final.mp4"), new AssetRef("local:image-0.png"));

    private final Map<GenerationStage, Consumer<TaskContext>> behaviour = new EnumMap<>(GenerationStage.class);
    private InMemoryTaskStore taskStore;
    private ProgressBus progressBus;
    private SimpleMeterRegistry meterRegistry;
    private RecordingSubscriber ownerSubscriber;

    @BeforeEach
    void setUp() {
        taskStore = new InMemoryTaskStore();
        progressBus = new ProgressBus(taskStore, Clock.systemUTC(), Duration.ofMinutes(10));
        meterRegistry = new SimpleMeterRegistry();
        ownerSubscriber = new RecordingSubscriber("owner-socket");
        progressBus.subscribeToUser("owner-1", ownerSubscriber);

        behaviour.put(GenerationStage.ANALYZING_PROMPT, context -> context.reportProgress(100));
        behaviour.put(GenerationStage.GENERATING_SCENES, context -> {
            context.reportProgress(60);
            context.task().assignScenes(List.of(scene(0, 12.0), scene(1, 8.0)));
        });
        behaviour.put(GenerationStage.GENERATING_IMAGES, context -> {
            for (Scene scene : context.task().scenes()) {
                context.task().updateScene(scene.index(), current -> current.withAssets(
                        current.assets().withImage(new AssetRef("local:image-" + scene.index() + ".png"))));
                context.reportProgress(50 * (scene.index() + 1));
            }
        });
        behaviour.put(GenerationStage.GENERATING_AUDIO, context -> context.reportProgress(100));
        behaviour.put(GenerationStage.GENERATING_MUSIC, context -> context.reportProgress(100));
        behaviour.put(GenerationStage.ASSEMBLING_VIDEO, context -> {
            context.reportProgress(90);
            context.recordResult(RESULT);
        });
    }

    @Test
    void runsEveryStageAndCompletes() {
        TaskRunner runner = runner(new SyncTaskExecutor());

        GenerationTaskSnapshot submitted = runner.submit("owner-1", "A fox in the snow", CONFIG);

        GenerationTaskSnapshot stored = taskStore.find(submitted.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(stored.overallProgress()).isEqualTo(100);
        assertThat(stored.result()).isEqualTo(RESULT);
        assertThat(stored.error()).isNull();
        assertThat(stored.scenes()).extracting(Scene::targetDuration).containsExactly(12.0, 8.0);
        assertThat(meterRegistry.counter("reel_forge.tasks.submitted").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("reel_forge.tasks.completed").count()).isEqualTo(1.0);
    }

    @Test
    void pushedProgressNeverDecreasesAndEndsCompleted() {
        TaskRunner runner = runner(new SyncTaskExecutor());

        runner.submit("owner-1", "A fox in the snow", CONFIG);

        List<ProgressEvent> events = ownerSubscriber.received();
        assertThat(events).isNotEmpty();
        assertThat(events.get(0).status()).isEqualTo(TaskStatus.PENDING);
        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).overallProgress()).isGreaterThanOrEqualTo(events.get(i - 1).overallProgress());
        }
        ProgressEvent last = events.get(events.size() - 1);
        assertThat(last.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(last.result()).isEqualTo(RESULT);
        assertThat(events).extracting(ProgressEvent::stage)
                .containsSubsequence(
                        GenerationStage.ANALYZING_PROMPT,
                        GenerationStage.GENERATING_SCENES,
                        GenerationStage.GENERATING_IMAGES,
                        GenerationStage.GENERATING_AUDIO,
                        GenerationStage.GENERATING_MUSIC,
                        GenerationStage.ASSEMBLING_VIDEO);
    }

    @Test
    void failureKeepsEarlierAssetsAndNamesTheStage() {
        behaviour.put(GenerationStage.GENERATING_AUDIO, context -> {
            throw new ProviderPermanentException("speech provider rejected the script");
        });
        TaskRunner runner = runner(new SyncTaskExecutor());

        GenerationTaskSnapshot submitted = runner.submit("owner-1", "A fox in the snow", CONFIG);

        GenerationTaskSnapshot stored = taskStore.find(submitted.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(stored.error().stage()).isEqualTo(GenerationStage.GENERATING_AUDIO);
        assertThat(stored.error().message())
                .isEqualTo("generating_audio failed: speech provider rejected the script");
        assertThat(stored.scenes()).hasSize(2)
                .allSatisfy(scene -> assertThat(scene.assets().image()).isNotNull());
        assertThat(stored.result()).isNull();
        assertThat(meterRegistry.counter("reel_forge.tasks.failed", "stage", "generating_audio").count())
                .isEqualTo(1.0);
    }

    @Test
    void unexpectedErrorsAreReportedGenerically() {
        behaviour.put(GenerationStage.GENERATING_MUSIC, context -> {
            throw new NullPointerException("mixer");
        });
        TaskRunner runner = runner(new SyncTaskExecutor());

        GenerationTaskSnapshot submitted = runner.submit("owner-1", "A fox in the snow", CONFIG);

        GenerationTaskSnapshot stored = taskStore.find(submitted.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(stored.error().message()).isEqualTo("generating_music failed: unexpected error. Check server logs.");
    }

    @Test
    void cancellationDuringStageStopsWithoutError() {
        AtomicReference<TaskRunner> runnerRef = new AtomicReference<>();
        AtomicReference<ProgressEvent> cancelResponse = new AtomicReference<>();
        behaviour.put(GenerationStage.GENERATING_IMAGES, context -> {
            cancelResponse.set(runnerRef.get().cancel(context.task().id()));
            context.checkCancelled();
        });
        TaskRunner runner = runner(new SyncTaskExecutor());
        runnerRef.set(runner);

        GenerationTaskSnapshot submitted = runner.submit("owner-1", "A fox in the snow", CONFIG);

        assertThat(cancelResponse.get().status()).isEqualTo(TaskStatus.CANCELLED);
        GenerationTaskSnapshot stored = taskStore.find(submitted.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(stored.error()).isNull();
        assertThat(stored.stage()).isEqualTo(GenerationStage.GENERATING_IMAGES);
        assertThat(stored.scenes()).hasSize(2);
        assertThat(meterRegistry.counter("reel_forge.tasks.cancelled").count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("reel_forge.tasks.failed").counters()).isEmpty();
    }

    @Test
    void taskCancelledWhileQueuedNeverStarts() {
        List<Runnable> queued = new ArrayList<>();
        TaskExecutor queueingExecutor = queued::add;
        TaskRunner runner = runner(queueingExecutor);

        GenerationTaskSnapshot submitted = runner.submit("owner-1", "A fox in the snow", CONFIG);
        runner.cancel(submitted.id());
        queued.forEach(Runnable::run);

        GenerationTaskSnapshot stored = taskStore.find(submitted.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.CANCELLED);
        assertThat(stored.stage()).isNull();
        assertThat(stored.stageProgress()).isEmpty();
    }

    @Test
    void cancellingUnknownOrFinishedTaskIsRejected() {
        TaskRunner runner = runner(new SyncTaskExecutor());
        GenerationTaskSnapshot finished = runner.submit("owner-1", "A fox in the snow", CONFIG);

        assertThatThrownBy(() -> runner.cancel("does-not-exist")).isInstanceOf(TaskNotFoundException.class);
        assertThatThrownBy(() -> runner.cancel(finished.id()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already completed");
    }

    @Test
    void listsOwnerTasksAndReadsStatusThroughTheBus() {
        TaskRunner runner = runner(new SyncTaskExecutor());
        GenerationTaskSnapshot first = runner.submit("owner-1", "First prompt", CONFIG);
        runner.submit("owner-2", "Other owner", CONFIG);

        assertThat(runner.listForOwner("owner-1")).extracting(ProgressEvent::taskId).containsExactly(first.id());
        assertThat(runner.getStatus(first.id())).hasValueSatisfying(
                event -> assertThat(event.status()).isEqualTo(TaskStatus.COMPLETED));
        assertThat(runner.getDetail(first.id())).hasValueSatisfying(
                detail -> assertThat(detail.prompt()).isEqualTo("First prompt"));
        assertThat(runner.getStatus("missing")).isEmpty();
    }

    @Test
    void everyStageNeedsExactlyOneHandler() {
        List<StageHandler> incomplete = handlers();
        incomplete.remove(incomplete.size() - 1);
        List<StageHandler> duplicated = handlers();
        duplicated.add(duplicated.get(0));

        assertThatThrownBy(() -> TaskRunner.indexHandlers(incomplete))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("assembling_video");
        assertThatThrownBy(() -> TaskRunner.indexHandlers(duplicated))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Two handlers");
    }

    private TaskRunner runner(TaskExecutor executor) {
        return new TaskRunner(
                handlers(),
                taskStore,
                progressBus,
                executor,
                StageWeightTable.defaults(),
                Clock.systemUTC(),
                meterRegistry);
    }

    private List<StageHandler> handlers() {
        List<StageHandler> handlers = new ArrayList<>();
        for (GenerationStage stage : GenerationStage.values()) {
            handlers.add(new StageHandler() {
                @Override
                public GenerationStage stage() {
                    return stage;
                }

                @Override
                public void execute(TaskContext context) {
                    behaviour.get(stage).accept(context);
                }
            });
        }
        return handlers;
    }

    private static Scene scene(int index, double targetSeconds) {
        return new Scene(index, "Scene " + index, "Narration " + index, "visual " + index, null, null,
                1.0, targetSeconds, null, null);
    }
}
