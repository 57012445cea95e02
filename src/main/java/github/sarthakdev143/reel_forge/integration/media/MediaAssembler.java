package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.OutputPreset;

import java.io.IOException;
import java.util.List;

/**
 * Combines per-scene tracks into the final video.
 */
public interface MediaAssembler {

    /**
     * Mixes narration over a quieter music bed. The output is as long as the speech track.
     */
    AssetRef mixAudio(AssetRef speech, AssetRef music) throws IOException, InterruptedException;

    /**
     * Scales the clip to the preset frame and replaces its audio with {@code audio}.
     */
    AssetRef muxScene(AssetRef video, AssetRef audio, OutputPreset preset) throws IOException, InterruptedException;

    /**
     * Joins scene clips in order, video and audio together.
     */
    AssetRef concatScenes(List<AssetRef> sceneClips) throws IOException, InterruptedException;
}
