package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.exception.MediaProcessingException;
import github.sarthakdev143.reel_forge.exception.ProviderTransientException;
import github.sarthakdev143.reel_forge.exception.TaskCancelledException;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.TaskResult;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * What a stage handler sees of its task while running.
 * <p>
 * Task-level progress and messages may only be written from the coordinating thread. Scene workers use
 * {@link #await}, {@link #cancellation()} and {@link GenerationTask#updateScene}.
 */
public class TaskContext {

    private static final long AWAIT_SLICE_MILLIS = 200;

    private final GenerationTask task;
    private final CancellationSignal cancellation;
    private final Consumer<GenerationTask> changeListener;
    private volatile TaskResult result;

    @FunctionalInterface
    public interface MediaCall<T> {
        T call() throws IOException, InterruptedException;
    }

    public TaskContext(GenerationTask task, CancellationSignal cancellation, Consumer<GenerationTask> changeListener) {
        this.task = task;
        this.cancellation = cancellation;
        this.changeListener = changeListener;
    }

    public GenerationTask task() {
        return task;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    public GenerationStage stage() {
        return task.stage();
    }

    public void checkCancelled() {
        cancellation.throwIfCancelled();
    }

    public void reportProgress(int percent) {
        checkCancelled();
        if (task.reportStageProgress(percent)) {
            changeListener.accept(task);
        }
    }

    public void updateMessage(String message) {
        checkCancelled();
        task.updateMessage(message);
        changeListener.accept(task);
    }

    /**
     * Set by the final stage; the runner completes the task with it.
     */
    public void recordResult(TaskResult taskResult) {
        this.result = taskResult;
    }

    public TaskResult result() {
        return result;
    }

    /**
     * Runs a media tool or storage call, turning interruption into cancellation and I/O failures into a stage
     * failure.
     */
    public <T> T media(MediaCall<T> call) {
        checkCancelled();
        try {
            return call.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException(task.id());
        } catch (IOException e) {
            GenerationStage current = stage();
            throw new MediaProcessingException(current, current.wireName() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Waits for a provider call, checking for cancellation while it is outstanding. A cancelled task abandons the
     * call locally; the provider is not told.
     */
    public <T> T await(CompletableFuture<T> future) {
        CountDownLatch done = new CountDownLatch(1);
        future.whenComplete((value, failure) -> done.countDown());
        try {
            while (!done.await(AWAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    future.cancel(true);
                    throw new TaskCancelledException(task.id());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TaskCancelledException(task.id());
        }

        try {
            return future.join();
        } catch (CancellationException e) {
            throw new TaskCancelledException(task.id());
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    private static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new ProviderTransientException("Provider call failed: " + cause.getMessage(), cause);
    }
}
