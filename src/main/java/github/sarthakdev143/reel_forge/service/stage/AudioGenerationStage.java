package github.sarthakdev143.reel_forge.service.stage;

import github.sarthakdev143.reel_forge.integration.provider.SpeechProvider;
import github.sarthakdev143.reel_forge.model.AdjustmentOptions;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.Scene;
import github.sarthakdev143.reel_forge.service.AdjustmentResult;
import github.sarthakdev143.reel_forge.service.DurationAdjuster;
import github.sarthakdev143.reel_forge.service.ParallelSceneExecutor;
import github.sarthakdev143.reel_forge.service.StageRetrier;
import github.sarthakdev143.reel_forge.service.TaskContext;
import org.springframework.stereotype.Component;

/**
 * Narration per scene, fitted to the scene's target duration.
 */
@Component
public class AudioGenerationStage implements StageHandler {

    private final SpeechProvider speechProvider;
    private final DurationAdjuster durationAdjuster;
    private final ParallelSceneExecutor sceneExecutor;
    private final StageRetrier retrier;

    public AudioGenerationStage(
            SpeechProvider speechProvider,
            DurationAdjuster durationAdjuster,
            ParallelSceneExecutor sceneExecutor,
            StageRetrier retrier) {
        this.speechProvider = speechProvider;
        this.durationAdjuster = durationAdjuster;
        this.sceneExecutor = sceneExecutor;
        this.retrier = retrier;
    }

    @Override
    public GenerationStage stage() {
        return GenerationStage.GENERATING_AUDIO;
    }

    @Override
    public void execute(TaskContext context) {
        GenerationTask task = context.task();
        context.updateMessage("Generating narration.");

        sceneExecutor.forEachScene(context, scene -> {
            double target = scene.targetDuration();
            AssetRef speech = retrier.execute(stage(), context.cancellation(), "speech for scene " + scene.index(),
                    () -> context.await(speechProvider.synthesizeSpeech(narrationText(scene), target)));
            AdjustmentResult fitted = retrier.execute(stage(), context.cancellation(), "speech timing for scene " + scene.index(),
                    () -> context.media(() -> durationAdjuster.probeAndAdjust(
                            speech, target, AdjustmentOptions.fadeOutPreservingPitch())));
            task.updateScene(scene.index(), current -> current
                    .withAssets(current.assets().withSpeech(fitted.ref()))
                    .withActualDuration(fitted.durationSeconds()));
        });
    }

    private static String narrationText(Scene scene) {
        if (scene.scriptText() != null && !scene.scriptText().isBlank()) {
            return scene.scriptText();
        }
        return scene.title() == null ? "" : scene.title();
    }
}
