package github.sarthakdev143.reel_forge.service.stage;

import github.sarthakdev143.reel_forge.integration.provider.ImageProvider;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.service.ParallelSceneExecutor;
import github.sarthakdev143.reel_forge.service.StageRetrier;
import github.sarthakdev143.reel_forge.service.TaskContext;
import org.springframework.stereotype.Component;

@Component
public class ImageGenerationStage implements StageHandler {

    private final ImageProvider imageProvider;
    private final ParallelSceneExecutor sceneExecutor;
    private final StageRetrier retrier;

    public ImageGenerationStage(ImageProvider imageProvider, ParallelSceneExecutor sceneExecutor, StageRetrier retrier) {
        this.imageProvider = imageProvider;
        this.sceneExecutor = sceneExecutor;
        this.retrier = retrier;
    }

    @Override
    public GenerationStage stage() {
        return GenerationStage.GENERATING_IMAGES;
    }

    @Override
    public void execute(TaskContext context) {
        GenerationTask task = context.task();
        context.updateMessage("Generating scene images.");

        sceneExecutor.forEachScene(context, scene -> {
            AssetRef image = retrier.execute(stage(), context.cancellation(), "image for scene " + scene.index(),
                    () -> context.await(imageProvider.generateImage(scene.visualPrompt(), task.config())));
            task.updateScene(scene.index(), current -> current.withAssets(current.assets().withImage(image)));
        });
    }
}
