package github.sarthakdev143.reel_forge.service.stage;

import github.sarthakdev143.reel_forge.integration.media.MediaAssembler;
import github.sarthakdev143.reel_forge.integration.provider.VideoProvider;
import github.sarthakdev143.reel_forge.model.AdjustmentOptions;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.Scene;
import github.sarthakdev143.reel_forge.model.TaskResult;
import github.sarthakdev143.reel_forge.service.AdjustmentResult;
import github.sarthakdev143.reel_forge.service.DurationAdjuster;
import github.sarthakdev143.reel_forge.service.ParallelSceneExecutor;
import github.sarthakdev143.reel_forge.service.StageRetrier;
import github.sarthakdev143.reel_forge.service.TaskContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Animates each scene, fits the clip to its mixed audio, muxes them, then joins all scenes and fits the result to
 * the task's total duration.
 */
@Component
public class VideoAssemblyStage implements StageHandler {

    private static final int SCENES_DONE_PERCENT = 80;
    private static final int CONCAT_DONE_PERCENT = 90;

    private final VideoProvider videoProvider;
    private final MediaAssembler mediaAssembler;
    private final DurationAdjuster durationAdjuster;
    private final ParallelSceneExecutor sceneExecutor;
    private final StageRetrier retrier;

    public VideoAssemblyStage(
            VideoProvider videoProvider,
            MediaAssembler mediaAssembler,
            DurationAdjuster durationAdjuster,
            ParallelSceneExecutor sceneExecutor,
            StageRetrier retrier) {
        this.videoProvider = videoProvider;
        this.mediaAssembler = mediaAssembler;
        this.durationAdjuster = durationAdjuster;
        this.sceneExecutor = sceneExecutor;
        this.retrier = retrier;
    }

    @Override
    public GenerationStage stage() {
        return GenerationStage.ASSEMBLING_VIDEO;
    }

    @Override
    public void execute(TaskContext context) {
        GenerationTask task = context.task();
        context.updateMessage("Assembling scenes.");

        sceneExecutor.forEachScene(context, scene -> {
            AssetRef clip = retrier.execute(stage(), context.cancellation(), "video for scene " + scene.index(),
                    () -> context.await(videoProvider.animateImage(
                            scene.assets().image(), scene.visualPrompt(), scene.targetDuration(), task.config())));

            AssetRef mixedAudio = scene.assets().mixedAudio();
            double audioSeconds = retrier.execute(stage(), context.cancellation(), "audio probe for scene " + scene.index(),
                    () -> durationAdjuster.probe(mixedAudio).durationSeconds());
            AdjustmentResult fittedClip = retrier.execute(stage(), context.cancellation(), "clip timing for scene " + scene.index(),
                    () -> context.media(() -> durationAdjuster.probeAndAdjust(clip, audioSeconds, AdjustmentOptions.plain())));
            task.updateScene(scene.index(), current -> current.withAssets(current.assets().withVideo(fittedClip.ref())));

            AssetRef finalScene = context.media(() -> mediaAssembler.muxScene(
                    fittedClip.ref(), mixedAudio, task.config().aspectRatio()));
            task.updateScene(scene.index(), current -> current.withAssets(current.assets().withFinalScene(finalScene)));
        }, 0, SCENES_DONE_PERCENT);

        context.updateMessage("Joining scenes.");
        List<AssetRef> sceneClips = new ArrayList<>();
        for (Scene scene : task.scenes()) {
            sceneClips.add(scene.assets().finalScene());
        }
        AssetRef joined = context.media(() -> mediaAssembler.concatScenes(sceneClips));
        context.reportProgress(CONCAT_DONE_PERCENT);

        AdjustmentResult finalVideo = retrier.execute(stage(), context.cancellation(), "final video timing",
                () -> context.media(() -> durationAdjuster.probeAndAdjust(
                        joined, task.config().totalDurationSeconds(), AdjustmentOptions.fadeOutPreservingPitch())));

        AssetRef thumbnail = task.scenes().isEmpty() ? null : task.scene(0).assets().image();
        context.recordResult(new TaskResult(finalVideo.ref(), thumbnail));
        context.reportProgress(100);
    }
}
