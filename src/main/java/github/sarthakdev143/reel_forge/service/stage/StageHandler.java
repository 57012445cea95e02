package github.sarthakdev143.reel_forge.service.stage;

import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.service.TaskContext;

/**
 * Work performed while a task is in one {@link GenerationStage}. Handlers may report progress below 100; the runner
 * pins the stage at 100 once {@link #execute} returns.
 */
public interface StageHandler {

    GenerationStage stage();

    void execute(TaskContext context);
}
