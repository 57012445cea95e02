package github.sarthakdev143.reel_forge.exception;

public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(String taskId) {
        super("Task not found for id: " + taskId);
    }
}
