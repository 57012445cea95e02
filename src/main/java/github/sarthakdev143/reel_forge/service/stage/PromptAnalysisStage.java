package github.sarthakdev143.reel_forge.service.stage;

import github.sarthakdev143.reel_forge.integration.provider.ScriptProvider;
import github.sarthakdev143.reel_forge.model.GenerationStage;
import github.sarthakdev143.reel_forge.model.GenerationTask;
import github.sarthakdev143.reel_forge.model.PromptAnalysis;
import github.sarthakdev143.reel_forge.service.StageRetrier;
import github.sarthakdev143.reel_forge.service.TaskContext;
import org.springframework.stereotype.Component;

@Component
public class PromptAnalysisStage implements StageHandler {

    private final ScriptProvider scriptProvider;
    private final StageRetrier retrier;

    public PromptAnalysisStage(ScriptProvider scriptProvider, StageRetrier retrier) {
        this.scriptProvider = scriptProvider;
        this.retrier = retrier;
    }

    @Override
    public GenerationStage stage() {
        return GenerationStage.ANALYZING_PROMPT;
    }

    @Override
    public void execute(TaskContext context) {
        GenerationTask task = context.task();
        context.updateMessage("Analyzing prompt.");

        PromptAnalysis analysis = retrier.execute(stage(), context.cancellation(), "prompt analysis",
                () -> context.await(scriptProvider.analyzePrompt(task.prompt(), task.config())));
        context.checkCancelled();
        task.recordPromptAnalysis(analysis);
        context.reportProgress(100);
    }
}
