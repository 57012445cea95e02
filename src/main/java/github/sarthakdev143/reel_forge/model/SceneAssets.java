package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-scene artifacts. Every slot is written at most once.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SceneAssets(
        AssetRef image,
        AssetRef speech,
        AssetRef music,
        AssetRef mixedAudio,
        AssetRef video,
        AssetRef finalScene) {

    public static SceneAssets empty() {
        return new SceneAssets(null, null, null, null, null, null);
    }

    public SceneAssets withImage(AssetRef ref) {
        requireUnset("image", image);
        return new SceneAssets(ref, speech, music, mixedAudio, video, finalScene);
    }

    public SceneAssets withSpeech(AssetRef ref) {
        requireUnset("speech", speech);
        return new SceneAssets(image, ref, music, mixedAudio, video, finalScene);
    }

    public SceneAssets withMusic(AssetRef ref) {
        requireUnset("music", music);
        return new SceneAssets(image, speech, ref, mixedAudio, video, finalScene);
    }

    public SceneAssets withMixedAudio(AssetRef ref) {
        requireUnset("mixedAudio", mixedAudio);
        return new SceneAssets(image, speech, music, ref, video, finalScene);
    }

    public SceneAssets withVideo(AssetRef ref) {
        requireUnset("video", video);
        return new SceneAssets(image, speech, music, mixedAudio, ref, finalScene);
    }

    public SceneAssets withFinalScene(AssetRef ref) {
        requireUnset("finalScene", finalScene);
        return new SceneAssets(image, speech, music, mixedAudio, video, ref);
    }

    private static void requireUnset(String slot, AssetRef current) {
        if (current != null) {
            throw new IllegalStateException("Scene asset '" + slot + "' is already set to " + current);
        }
    }
}
