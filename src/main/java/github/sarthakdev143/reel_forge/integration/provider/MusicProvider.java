package github.sarthakdev143.reel_forge.integration.provider;

import github.sarthakdev143.reel_forge.model.AssetRef;

import java.util.concurrent.CompletableFuture;

public interface MusicProvider {

    CompletableFuture<AssetRef> composeMusic(String musicPrompt, double durationSeconds);
}
