package github.sarthakdev143.reel_forge.service.impl;

import github.sarthakdev143.reel_forge.exception.GenerationException;
import github.sarthakdev143.reel_forge.exception.TaskCancelledException;
import github.sarthakdev143.reel_forge.exception.TaskNotFoundException;
import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.ProgressEvent;
import github.sarthakdev143.reel_forge.model.StageWeightTable;
import github.sarthakdev143.reel_forge.model.TaskResult;
import github.sarthakdev143.reel_forge.model.TaskStatus;
import github.sarthakdev143.reel_forge.repository.TaskStore;
import github.sarthakdev143.reel_forge.service.CancellationSignal;
import github.sarthakdev143.reel_forge.service.GenerationTaskService;
import github.sarthakdev143.reel_forge.service.ProgressBus;
import github.sarthakdev143.reel_forge.service.TaskContext;
import github.sarthakdev143.reel_forge.service.stage.StageHandler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives generation tasks through their stages.
 * <p>
 * Each task runs on its own worker from the generation executor; excess submissions wait in the executor queue.
 * After every state change the task is persisted and then published, so pushes and pulls see the same state.
 */
@Service
public class TaskRunner implements GenerationTaskService {

    private static final Logger logger = LoggerFactory.getLogger(TaskRunner.class);

    private final Map<GenerationStage, StageHandler> handlers;
    private final TaskStore taskStore;
    private final ProgressBus progressBus;
    private final TaskExecutor taskExecutor;
    private final StageWeightTable weights;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Map<String, RunningTask> running = new ConcurrentHashMap<>();
    private final Counter submittedCounter;
    private final Counter completedCounter;
    private final Counter cancelledCounter;

    public TaskRunner(
            List<StageHandler> stageHandlers,
            TaskStore taskStore,
            ProgressBus progressBus,
            @Qualifier("generationTaskExecutor") TaskExecutor taskExecutor,
            StageWeightTable weights,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.handlers = indexHandlers(stageHandlers);
        this.taskStore = taskStore;
        this.progressBus = progressBus;
        this.taskExecutor = taskExecutor;
        this.weights = weights;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.submittedCounter = meterRegistry.counter("reel_forge.tasks.submitted");
        this.completedCounter = meterRegistry.counter("reel_forge.tasks.completed");
        this.cancelledCounter = meterRegistry.counter("reel_forge.tasks.cancelled");
    }

    /**
     * Every stage needs exactly one handler; a gap fails startup rather than a task.
     */
    static Map<GenerationStage, StageHandler> indexHandlers(List<StageHandler> stageHandlers) {
        Map<GenerationStage, StageHandler> indexed = new EnumMap<>(GenerationStage.class);
        for (StageHandler handler : stageHandlers) {
            StageHandler previous = indexed.put(handler.stage(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for stage " + handler.stage().wireName());
            }
        }
        for (GenerationStage stage : GenerationStage.values()) {
            if (!indexed.containsKey(stage)) {
                throw new IllegalStateException("No handler registered for stage " + stage.wireName());
            }
        }
        return indexed;
    }

    @Override
    public GenerationTaskSnapshot submit(String ownerId, String prompt, GenerationConfig config) {
        GenerationTask task = GenerationTask.create(ownerId, prompt, config, weights, clock);
        CancellationSignal signal = new CancellationSignal(task.id());
        running.put(task.id(), new RunningTask(task, signal));
        GenerationTaskSnapshot snapshot = persistAndPublish(task);
        submittedCounter.increment();

        logger.info("Accepted generation task {} owner={} duration={}s aspectRatio={}",
                task.id(), ownerId, config.totalDurationSeconds(), config.aspectRatio().aspectRatio());
        taskExecutor.execute(() -> runTask(task, signal));
        return snapshot;
    }

    @Override
    public ProgressEvent cancel(String taskId) {
        RunningTask runningTask = running.get(taskId);
        if (runningTask == null) {
            GenerationTaskSnapshot stored = taskStore.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
            throw new IllegalStateException("Task " + taskId + " is already " + stored.status().wireName() + ".");
        }

        GenerationTask task = runningTask.task();
        if (!task.cancel()) {
            throw new IllegalStateException("Task " + taskId + " is already " + task.status().wireName() + ".");
        }
        runningTask.signal().cancel();
        cancelledCounter.increment();
        logger.info("Cancelled generation task {} during {}", taskId, task.stage() == null ? "queue" : task.stage().wireName());
        return ProgressEvent.from(persistAndPublish(task));
    }

    @Override
    public Optional<ProgressEvent> getStatus(String taskId) {
        return progressBus.getStatus(taskId);
    }

    @Override
    public Optional<GenerationTaskSnapshot> getDetail(String taskId) {
        return taskStore.find(taskId);
    }

    @Override
    public List<ProgressEvent> listForOwner(String ownerId) {
        return taskStore.findByOwner(ownerId).stream()
                .map(ProgressEvent::from)
                .toList();
    }

    void runTask(GenerationTask task, CancellationSignal signal) {
        TaskContext context = new TaskContext(task, signal, this::persistAndPublish);
        try {
            for (GenerationStage stage : GenerationStage.values()) {
                signal.throwIfCancelled();
                task.enterStage(stage);
                logger.info("Task {} entered stage {}", task.id(), stage.wireName());
                persistAndPublish(task);

                handlers.get(stage).execute(context);

                signal.throwIfCancelled();
                if (task.reportStageProgress(100)) {
                    persistAndPublish(task);
                }
            }
            finish(task, context.result());
        } catch (TaskCancelledException e) {
            logger.info("Task {} stopped after cancellation", task.id());
        } catch (GenerationException e) {
            handleFailure(task, e.getStage() != null ? e.getStage() : task.stage(), e.getMessage(), e);
        } catch (IllegalStateException e) {
            if (task.status() == TaskStatus.CANCELLED) {
                logger.info("Task {} stopped after cancellation", task.id());
            } else {
                handleUnexpected(task, e);
            }
        } catch (RuntimeException e) {
            handleUnexpected(task, e);
        } finally {
            running.remove(task.id());
        }
    }

    private void finish(GenerationTask task, TaskResult result) {
        if (result == null) {
            throw new IllegalStateException("Task " + task.id() + " finished without a result");
        }
        task.complete(result);
        persistAndPublish(task);
        completedCounter.increment();
        logger.info("Task {} completed video={} thumbnail={}", task.id(), result.videoRef(), result.thumbnailRef());
    }

    private void handleUnexpected(GenerationTask task, RuntimeException e) {
        GenerationStage stage = task.stage();
        String stageName = stage == null ? "task" : stage.wireName();
        logger.error("Task {} failed unexpectedly in {}", task.id(), stageName, e);
        recordFailure(task, stage, stageName + " failed: unexpected error. Check server logs.");
    }

    private void handleFailure(GenerationTask task, GenerationStage stage, String message, GenerationException e) {
        String stageName = stage == null ? "task" : stage.wireName();
        logger.warn("Task {} failed in {}: {}", task.id(), stageName, message, e);
        recordFailure(task, stage, stageName + " failed: " + message);
    }

    private void recordFailure(GenerationTask task, GenerationStage stage, String message) {
        if (task.status().isTerminal()) {
            return;
        }
        try {
            task.fail(stage, message);
        } catch (IllegalStateException raced) {
            logger.info("Task {} reached {} before its failure could be recorded", task.id(), task.status().wireName());
            return;
        }
        persistAndPublish(task);
        meterRegistry.counter("reel_forge.tasks.failed", "stage", stage == null ? "none" : stage.wireName()).increment();
    }

    /**
     * Saves under the task's lock so a stale snapshot from the worker can never overwrite a newer one written by
     * {@link #cancel}.
     */
    private GenerationTaskSnapshot persistAndPublish(GenerationTask task) {
        GenerationTaskSnapshot snapshot;
        synchronized (task) {
            snapshot = task.snapshot();
            taskStore.save(snapshot);
        }
        progressBus.publish(task.id());
        return snapshot;
    }

    private record RunningTask(GenerationTask task, CancellationSignal signal) {
    }
}
