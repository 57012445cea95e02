package github.sarthakdev143.reel_forge.integration.provider;

import github.sarthakdev143.reel_forge.model.AssetRef;

import java.util.concurrent.CompletableFuture;

public interface SpeechProvider {

    /**
     * @param targetDurationSeconds a pacing hint; the returned track is not guaranteed to match it
     */
    CompletableFuture<AssetRef> synthesizeSpeech(String text, double targetDurationSeconds);
}
