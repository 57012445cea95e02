package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.exception.TaskCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation flag shared by a task's coordinator and its scene workers.
 */
public class CancellationSignal {

    private final String taskId;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public CancellationSignal(String taskId) {
        this.taskId = taskId;
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new TaskCancelledException(taskId);
        }
    }

    /**
     * Sleeps for {@code duration}, waking early and throwing when the task is cancelled.
     */
    public void sleep(Duration duration) {
        try {
            if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TaskCancelledException(taskId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException(taskId);
        }
    }
}
