package github.sarthakdev143.reel_forge.service.stage;

import github.sarthakdev143.reel_forge.integration.provider.ScriptProvider;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.Scene;
import github.sarthakdev143.reel_forge.model.SceneOutline;
import github.sarthakdev143.reel_forge.service.SceneDurationAllocator;
import github.sarthakdev143.reel_forge.service.StageRetrier;
import github.sarthakdev143.reel_forge.service.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaks the prompt into scenes and allocates the total duration across them.
 */
@Component
public class SceneBreakdownStage implements StageHandler {

    private static final Logger logger = LoggerFactory.getLogger(SceneBreakdownStage.class);

    private final ScriptProvider scriptProvider;
    private final SceneDurationAllocator allocator;
    private final StageRetrier retrier;

    public SceneBreakdownStage(ScriptProvider scriptProvider, SceneDurationAllocator allocator, StageRetrier retrier) {
        this.scriptProvider = scriptProvider;
        this.allocator = allocator;
        this.retrier = retrier;
    }

    @Override
    public GenerationStage stage() {
        return GenerationStage.GENERATING_SCENES;
    }

    @Override
    public void execute(TaskContext context) {
        GenerationTask task = context.task();
        context.updateMessage("Writing scenes.");

        List<SceneOutline> outlines = retrier.execute(stage(), context.cancellation(), "scene breakdown",
                () -> context.await(scriptProvider.breakdownScenes(task.prompt(), task.promptAnalysis(), task.config())));
        context.reportProgress(60);

        List<Scene> scenes = new ArrayList<>(outlines.size());
        for (int index = 0; index < outlines.size(); index++) {
            scenes.add(Scene.fromOutline(index, outlines.get(index)));
        }
        List<Scene> timed = allocator.assignTargets(scenes, task.config().totalDurationSeconds());

        context.checkCancelled();
        task.assignScenes(timed);
        logger.info("Task {} split into {} scenes over {}s", task.id(), timed.size(), task.config().totalDurationSeconds());
        context.reportProgress(100);
    }
}
