package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.exception.TaskNotFoundException;
import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.ProgressEvent;

import java.util.List;
import java.util.Optional;

public interface GenerationTaskService {

    /**
     * Accepts a task and queues it for execution.
     *
     * @return the pending snapshot
     */
    GenerationTaskSnapshot submit(String ownerId, String prompt, GenerationConfig config);

    /**
     * Requests cooperative cancellation.
     *
     * @throws TaskNotFoundException when the id is unknown
     * @throws IllegalStateException when the task already reached a terminal status
     */
    ProgressEvent cancel(String taskId);

    Optional<ProgressEvent> getStatus(String taskId);

    Optional<GenerationTaskSnapshot> getDetail(String taskId);

    List<ProgressEvent> listForOwner(String ownerId);
}
