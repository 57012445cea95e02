package github.sarthakdev143.reel_forge.integration.provider;

import github.sarthakdev143.reel_forge.model.GenerationConfig;
import github.sarthakdev143.reel_forge.model.PromptAnalysis;
import github.sarthakdev143.reel_forge.model.SceneOutline;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Prompt understanding and scene breakdown.
 * <p>
 * Futures complete exceptionally with {@link github.sarthakdev143.reel_forge.exception.ProviderTransientException}
 * or {@link github.sarthakdev143.reel_forge.exception.ProviderPermanentException}.
 */
public interface ScriptProvider {

    CompletableFuture<PromptAnalysis> analyzePrompt(String prompt, GenerationConfig config);

    CompletableFuture<List<SceneOutline>> breakdownScenes(String prompt, PromptAnalysis analysis, GenerationConfig config);
}
