package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.exception.MediaProcessingException;
import github.sarthakdev143.reel_forge.exception.TaskCancelledException;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.Scene;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs per-scene work for one stage with at most {@code sceneConcurrency} scenes in flight per task.
 * <p>
 * The calling coordinator thread collects completions and is the only one that reports stage progress. The first
 * failing scene aborts the remaining work.
 */
@Component
public class ParallelSceneExecutor {

    private static final long POLL_MILLIS = 200;

    @FunctionalInterface
    public interface SceneWork {
        void run(Scene scene) throws Exception;
    }

    private final Executor sceneWorkExecutor;
    private final int sceneConcurrency;

    @Autowired
    public ParallelSceneExecutor(
            @Qualifier("sceneWorkExecutor") Executor sceneWorkExecutor,
            ReelForgeProperties properties) {
        this(sceneWorkExecutor, properties.tasks().sceneConcurrency());
    }

    public ParallelSceneExecutor(Executor sceneWorkExecutor, int sceneConcurrency) {
        this.sceneWorkExecutor = sceneWorkExecutor;
        this.sceneConcurrency = Math.max(1, sceneConcurrency);
    }

    public void forEachScene(TaskContext context, SceneWork work) {
        forEachScene(context, work, 0, 100);
    }

    /**
     * Stage progress moves linearly from {@code fromPercent} to {@code toPercent} as scenes finish.
     */
    public void forEachScene(TaskContext context, SceneWork work, int fromPercent, int toPercent) {
        List<Scene> scenes = context.task().scenes();
        GenerationStage stage = context.stage();
        if (scenes.isEmpty()) {
            context.reportProgress(toPercent);
            return;
        }

        CompletionService<Integer> completionService = new ExecutorCompletionService<>(sceneWorkExecutor);
        List<Future<Integer>> submitted = new ArrayList<>();
        int total = scenes.size();
        int nextToSubmit = 0;
        int running = 0;
        int completed = 0;

        try {
            while (completed < total) {
                while (running < sceneConcurrency && nextToSubmit < total) {
                    Scene scene = scenes.get(nextToSubmit);
                    submitted.add(completionService.submit(() -> {
                        context.checkCancelled();
                        work.run(scene);
                        return scene.index();
                    }));
                    nextToSubmit++;
                    running++;
                }

                Future<Integer> finished = completionService.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                context.checkCancelled();
                if (finished == null) {
                    continue;
                }

                running--;
                awaitScene(finished, stage);
                completed++;
                context.reportProgress(fromPercent + (toPercent - fromPercent) * completed / total);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException(context.task().id());
        } finally {
            for (Future<Integer> future : submitted) {
                if (!future.isDone()) {
                    future.cancel(true);
                }
            }
        }
    }

    private void awaitScene(Future<Integer> finished, GenerationStage stage) throws InterruptedException {
        try {
            finished.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            if (cause instanceof InterruptedException) {
                throw (InterruptedException) cause;
            }
            throw new MediaProcessingException(stage, stage.wireName() + " failed: " + cause.getMessage(), cause);
        }
    }
}
