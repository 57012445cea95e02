package github.sarthakdev143.reel_forge.exception;

/**
 * Cooperative abort. Never recorded as a task error.
 */
public class TaskCancelledException extends GenerationException {

    public TaskCancelledException(String taskId) {
        super(null, "Task " + taskId + " was cancelled.");
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
