package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.MediaKind;

import java.io.IOException;

/**
 * Primitive duration edits on stored media. Each call produces a new asset and leaves the source untouched.
 */
public interface MediaEditor {

    /**
     * Cuts the asset to its first {@code targetSec} seconds, applying fades over the trimmed result.
     */
    AssetRef trim(AssetRef source, MediaKind kind, double targetSec, FadePlan fades)
            throws IOException, InterruptedException;

    /**
     * Time-stretches audio by {@code speedFactor} (below 1.0 slows down).
     *
     * @param preservePitch tempo change with unchanged pitch when true, plain resampling otherwise
     */
    AssetRef stretchAudio(AssetRef source, double speedFactor, boolean preservePitch, double targetSec, FadePlan fades)
            throws IOException, InterruptedException;

    /**
     * Repeats audio until {@code targetSec} is reached.
     */
    AssetRef loopAudio(AssetRef source, double targetSec, FadePlan fades)
            throws IOException, InterruptedException;

    /**
     * Extends video by holding its final frame. When {@code stretchAudioTrack} is set the clip's own audio track is
     * stretched with the audio policy instead of being padded with silence.
     */
    AssetRef extendVideo(
            AssetRef source,
            double sourceSec,
            double targetSec,
            boolean stretchAudioTrack,
            boolean preservePitch,
            FadePlan fades) throws IOException, InterruptedException;
}
