package github.sarthakdev143.reel_forge.integration.provider;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.GenerationConfig;

import java.util.concurrent.CompletableFuture;

public interface ImageProvider {

    CompletableFuture<AssetRef> generateImage(String visualPrompt, GenerationConfig config);
}
