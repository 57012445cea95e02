package github.sarthakdev143.reel_forge.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Persisted task row. The full snapshot lives in {@code payload} as JSON; the other columns exist for lookups.
 */
@Entity
@Table(name = "generation_task", indexes = {
        @Index(name = "idx_generation_task_owner", columnList = "owner_id"),
        @Index(name = "idx_generation_task_status", columnList = "status")
})
public class GenerationTaskRecord {

    @Id
    @Column(name = "task_id", nullable = false, length = 36)
    private String taskId;

    @Column(name = "owner_id", length = 128)
    private String ownerId;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Lob
    @Column(name = "payload", nullable = false)
    private String payload;

    protected GenerationTaskRecord() {
    }

    public GenerationTaskRecord(String taskId, String ownerId, String status, Instant createdAt, Instant updatedAt, String payload) {
        this.taskId = taskId;
        this.ownerId = ownerId;
        this.status = status;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.payload = payload;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }
}
