package github.sarthakdev143.reel_forge.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.TaskStatus;
import github.sarthakdev143.reel_forge.model.entity.GenerationTaskRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Task store backed by Spring Data JPA, one row per task holding the snapshot as JSON.
 */
@Repository
@ConditionalOnProperty(prefix = "reel-forge.store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaTaskStore implements TaskStore {

    private static final List<String> TERMINAL_STATUSES = List.of(
            TaskStatus.COMPLETED.wireName(),
            TaskStatus.FAILED.wireName(),
            TaskStatus.CANCELLED.wireName());

    private final GenerationTaskRecordRepository recordRepository;
    private final ObjectMapper objectMapper;

    public JpaTaskStore(GenerationTaskRecordRepository recordRepository, ObjectMapper objectMapper) {
        this.recordRepository = recordRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(GenerationTaskSnapshot snapshot) {
        String payload = serialize(snapshot);
        GenerationTaskRecord record = recordRepository.findById(snapshot.id())
                .orElseGet(() -> new GenerationTaskRecord(
                        snapshot.id(),
                        snapshot.ownerId(),
                        snapshot.status().wireName(),
                        snapshot.createdAt(),
                        snapshot.updatedAt(),
                        payload));
        record.setStatus(snapshot.status().wireName());
        record.setUpdatedAt(snapshot.updatedAt());
        record.setPayload(payload);
        recordRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GenerationTaskSnapshot> find(String taskId) {
        return recordRepository.findById(taskId).map(this::deserialize);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GenerationTaskSnapshot> findByOwner(String ownerId) {
        return recordRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(this::deserialize)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<GenerationTaskSnapshot> findUnfinished() {
        return recordRepository.findByStatusNotIn(TERMINAL_STATUSES).stream()
                .map(this::deserialize)
                .toList();
    }

    private String serialize(GenerationTaskSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize task " + snapshot.id(), e);
        }
    }

    private GenerationTaskSnapshot deserialize(GenerationTaskRecord record) {
        try {
            return objectMapper.readValue(record.getPayload(), GenerationTaskSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored task " + record.getTaskId() + " is unreadable", e);
        }
    }
}
