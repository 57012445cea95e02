package github.sarthakdev143.reel_forge.repository;

import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Tasks do not survive a restart.
 */
@Repository
@ConditionalOnProperty(prefix = "reel-forge.store", name = "type", havingValue = "memory")
public class InMemoryTaskStore implements TaskStore {

    private final Map<String, GenerationTaskSnapshot> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(GenerationTaskSnapshot snapshot) {
        tasks.put(snapshot.id(), snapshot);
    }

    @Override
    public Optional<GenerationTaskSnapshot> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<GenerationTaskSnapshot> findByOwner(String ownerId) {
        return tasks.values().stream()
                .filter(snapshot -> Objects.equals(snapshot.ownerId(), ownerId))
                .sorted(Comparator.comparing(GenerationTaskSnapshot::createdAt).reversed())
                .toList();
    }

    @Override
    public List<GenerationTaskSnapshot> findUnfinished() {
        return tasks.values().stream()
                .filter(snapshot -> !snapshot.status().isTerminal())
                .toList();
    }
}
