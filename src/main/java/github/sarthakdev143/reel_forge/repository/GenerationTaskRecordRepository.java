package github.sarthakdev143.reel_forge.repository;

import github.sarthakdev143.reel_forge.model.entity.GenerationTaskRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface GenerationTaskRecordRepository extends JpaRepository<GenerationTaskRecord, String> {

    List<GenerationTaskRecord> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<GenerationTaskRecord> findByStatusNotIn(Collection<String> statuses);
}
