package github.sarthakdev143.reel_forge.service.impl;

import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.GenerationTaskSnapshot;
import github.sarthakdev143.reel_forge.model.StageWeightTable;
import github.sarthakdev143.reel_forge.repository.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Tasks still live in the store at startup were cut off by a previous shutdown. They are marked failed so pulls
 * report them accurately.
 */
@Component
public class InterruptedTaskRecovery implements ApplicationRunner {

    static final String INTERRUPTED_MESSAGE = "Interrupted by server restart";

    private static final Logger logger = LoggerFactory.getLogger(InterruptedTaskRecovery.class);

    private final TaskStore taskStore;
    private final StageWeightTable weights;
    private final Clock clock;

    public InterruptedTaskRecovery(TaskStore taskStore, StageWeightTable weights, Clock clock) {
        this.taskStore = taskStore;
        this.weights = weights;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        recover();
    }

    public int recover() {
        List<GenerationTaskSnapshot> unfinished = taskStore.findUnfinished();
        for (GenerationTaskSnapshot snapshot : unfinished) {
            GenerationTask task = GenerationTask.restore(snapshot, weights, clock);
            GenerationStage stage = task.stage();
            task.fail(stage, INTERRUPTED_MESSAGE);
            taskStore.save(task.snapshot());
            logger.warn("Marked task {} failed; it was {} when the previous process stopped",
                    snapshot.id(), snapshot.status().wireName());
        }
        return unfinished.size();
    }
}
