package github.sarthakdev143.reel_forge.repository;

import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of every task's latest snapshot, keyed by task id.
 */
public interface TaskStore {

    void save(GenerationTaskSnapshot snapshot);

    Optional<GenerationTaskSnapshot> find(String taskId);

    /**
     * Newest first.
     */
    List<GenerationTaskSnapshot> findByOwner(String ownerId);

    List<GenerationTaskSnapshot> findUnfinished();
}
