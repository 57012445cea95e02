package github.sarthakdev143.reel_forge.integration.provider;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationConfig;

import java.util.concurrent.CompletableFuture;

/**
 * Animates a still scene image into a clip.
 */
public interface VideoProvider {

    CompletableFuture<AssetRef> animateImage(AssetRef image, String visualPrompt, double durationSeconds, GenerationConfig config);
}
