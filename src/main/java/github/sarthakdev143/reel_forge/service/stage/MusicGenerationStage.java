package github.sarthakdev143.reel_forge.service.stage;

import github.sarthakdev143.reel_forge.integration.media.MediaAssembler;
import github.sarthakdev143.reel_forge.integration.provider.MusicProvider;
import github.sarthakdev143.reel_forge.model.AdjustmentOptions;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.PromptAnalysis;
import github.sarthakdev143.reel_forge.model.Scene;
import github.sarthakdev143.reel_forge.service.AdjustmentResult;
import github.sarthakdev143.reel_forge.service.DurationAdjuster;
import github.sarthakdev143.reel_forge.service.ParallelSceneExecutor;
import github.sarthakdev143.reel_forge.service.StageRetrier;
import github.sarthakdev143.reel_forge.service.TaskContext;
import org.springframework.stereotype.Component;

/**
 * Music bed per scene, then the scene's mixed narration and music track.
 */
@Component
public class MusicGenerationStage implements StageHandler {

    private static final AdjustmentOptions MUSIC_OPTIONS = new AdjustmentOptions(true, true, true);

    private final MusicProvider musicProvider;
    private final MediaAssembler mediaAssembler;
    private final DurationAdjuster durationAdjuster;
    private final ParallelSceneExecutor sceneExecutor;
    private final StageRetrier retrier;

    public MusicGenerationStage(
            MusicProvider musicProvider,
            MediaAssembler mediaAssembler,
            DurationAdjuster durationAdjuster,
            ParallelSceneExecutor sceneExecutor,
            StageRetrier retrier) {
        this.musicProvider = musicProvider;
        this.mediaAssembler = mediaAssembler;
        this.durationAdjuster = durationAdjuster;
        this.sceneExecutor = sceneExecutor;
        this.retrier = retrier;
    }

    @Override
    public GenerationStage stage() {
        return GenerationStage.GENERATING_MUSIC;
    }

    @Override
    public void execute(TaskContext context) {
        GenerationTask task = context.task();
        context.updateMessage("Generating music.");
        String fallbackPrompt = fallbackMusicPrompt(task.promptAnalysis(), task.config().style());

        sceneExecutor.forEachScene(context, scene -> {
            double target = scene.targetDuration();
            String prompt = scene.musicPrompt() == null || scene.musicPrompt().isBlank() ? fallbackPrompt : scene.musicPrompt();

            AssetRef music = retrier.execute(stage(), context.cancellation(), "music for scene " + scene.index(),
                    () -> context.await(musicProvider.composeMusic(prompt, target)));
            AdjustmentResult fittedMusic = retrier.execute(stage(), context.cancellation(), "music timing for scene " + scene.index(),
                    () -> context.media(() -> durationAdjuster.probeAndAdjust(music, target, MUSIC_OPTIONS)));
            task.updateScene(scene.index(), current -> current.withAssets(current.assets().withMusic(fittedMusic.ref())));

            Scene withSpeech = task.scene(scene.index());
            AssetRef mixed = context.media(() -> mediaAssembler.mixAudio(withSpeech.assets().speech(), fittedMusic.ref()));
            AdjustmentResult fittedMix = retrier.execute(stage(), context.cancellation(), "mix timing for scene " + scene.index(),
                    () -> context.media(() -> durationAdjuster.probeAndAdjust(mixed, target, AdjustmentOptions.plain())));
            task.updateScene(scene.index(), current -> current
                    .withAssets(current.assets().withMixedAudio(fittedMix.ref()))
                    .withActualDuration(fittedMix.durationSeconds()));
        });
    }

    private static String fallbackMusicPrompt(PromptAnalysis analysis, String style) {
        StringBuilder prompt = new StringBuilder("instrumental background music");
        if (analysis != null && analysis.tone() != null && !analysis.tone().isBlank()) {
            prompt.append(", ").append(analysis.tone());
        }
        if (style != null && !style.isBlank()) {
            prompt.append(", ").append(style);
        }
        return prompt.toString();
    }
}
