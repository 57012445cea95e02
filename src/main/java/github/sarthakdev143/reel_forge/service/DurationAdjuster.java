package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.config.ReelForgeProperties;
import github.sarthakdev143.reel_forge.exception.AdjustmentDivergenceException;
import github.sarthakdev143.reel_forge.exception.ProbeFailureException;
import github.sarthakdev143.reel_forge.integration.media.FadePlan;
import github.sarthakdev143.reel_forge.integration.media.MediaEditor;
import github.sarthakdev143.reel_forge.integration.media.MediaProbe;
import github.sarthakdev143.reel_forge.model.AdjustmentOptions;
import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.MediaKind;
import github.sarthakdev143.reel_forge.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Normalizes one audio or video asset to a target duration.
 * <p>
 * Longer media is trimmed from the end. Shorter audio is time-stretched, or looped when it is under half the target.
 * Shorter video holds its last frame. Every output is probed; when it misses the target by more than epsilon the edit
 * is redone from the source with a compensated length, up to the configured number of corrective passes.
 */
@Component
public class DurationAdjuster {

    private static final Logger logger = LoggerFactory.getLogger(DurationAdjuster.class);
    private static final double LOOP_THRESHOLD_RATIO = 0.5;

    private final MediaProbe mediaProbe;
    private final MediaEditor mediaEditor;
    private final double epsilonSeconds;
    private final int maxCorrectivePasses;

    @Autowired
    public DurationAdjuster(MediaProbe mediaProbe, MediaEditor mediaEditor, ReelForgeProperties properties) {
        this(mediaProbe, mediaEditor, properties.timing().epsilonSeconds(), properties.timing().maxCorrectivePasses());
    }

    public DurationAdjuster(MediaProbe mediaProbe, MediaEditor mediaEditor, double epsilonSeconds, int maxCorrectivePasses) {
        if (epsilonSeconds <= 0) {
            throw new IllegalArgumentException("Epsilon must be positive.");
        }
        this.mediaProbe = mediaProbe;
        this.mediaEditor = mediaEditor;
        this.epsilonSeconds = epsilonSeconds;
        this.maxCorrectivePasses = Math.max(1, maxCorrectivePasses);
    }

    public double epsilonSeconds() {
        return epsilonSeconds;
    }

    /**
     * @throws ProbeFailureException when the probe cannot read the asset
     */
    public ProbeResult probe(AssetRef ref) {
        ProbeResult result = mediaProbe.probe(ref);
        if (!result.ok() || Double.isNaN(result.durationSeconds())) {
            throw new ProbeFailureException("Could not probe duration of " + ref);
        }
        return result;
    }

    public AdjustmentResult probeAndAdjust(AssetRef source, double targetSeconds, AdjustmentOptions options)
            throws InterruptedException {
        ProbeResult probed = probe(source);
        return adjust(source, probed.kind(), probed.durationSeconds(), targetSeconds, options);
    }

    public AdjustmentResult adjust(
            AssetRef source,
            MediaKind kind,
            double actualSeconds,
            double targetSeconds,
            AdjustmentOptions options) throws InterruptedException {
        if (!(targetSeconds > 0)) {
            throw new IllegalArgumentException("Target duration must be positive.");
        }
        if (kind != MediaKind.AUDIO && kind != MediaKind.VIDEO) {
            throw new IllegalArgumentException("Only audio and video can be adjusted, got " + kind);
        }
        if (withinTolerance(actualSeconds, targetSeconds)) {
            return new AdjustmentResult(source, actualSeconds, false);
        }

        double requested = targetSeconds;
        double lastProbed = Double.NaN;
        for (int pass = 1; pass <= maxCorrectivePasses; pass++) {
            AssetRef output = applyOnce(source, kind, actualSeconds, requested, options);
            lastProbed = probe(output).durationSeconds();
            if (withinTolerance(lastProbed, targetSeconds)) {
                logger.debug("Adjusted {} {} from {}s to {}s in {} pass(es)", kind, source, actualSeconds, lastProbed, pass);
                return new AdjustmentResult(output, lastProbed, true);
            }

            logger.warn("Adjustment pass {} of {} produced {}s, target {}s", pass, source, lastProbed, targetSeconds);
            requested = Math.max(epsilonSeconds, requested + (targetSeconds - lastProbed));
        }

        throw new AdjustmentDivergenceException(String.format(
                "Could not bring %s to %.3fs within %.3fs after %d passes (last %.3fs).",
                source, targetSeconds, epsilonSeconds, maxCorrectivePasses, lastProbed));
    }

    private AssetRef applyOnce(
            AssetRef source,
            MediaKind kind,
            double actualSeconds,
            double requestedSeconds,
            AdjustmentOptions options) throws InterruptedException {
        FadePlan fades = options.fadeIn() || options.fadeOut()
                ? FadePlan.forDuration(requestedSeconds, options.fadeIn(), options.fadeOut())
                : FadePlan.none();
        try {
            if (actualSeconds > requestedSeconds) {
                return mediaEditor.trim(source, kind, requestedSeconds, fades);
            }
            if (kind == MediaKind.VIDEO) {
                return mediaEditor.extendVideo(
                        source, actualSeconds, requestedSeconds, options.preservePitch(), true, fades);
            }
            if (actualSeconds < requestedSeconds * LOOP_THRESHOLD_RATIO) {
                return mediaEditor.loopAudio(source, requestedSeconds, fades);
            }
            return mediaEditor.stretchAudio(
                    source, actualSeconds / requestedSeconds, options.preservePitch(), requestedSeconds, fades);
        } catch (IOException e) {
            throw new AdjustmentDivergenceException("Media edit of " + source + " failed: " + e.getMessage(), e);
        }
    }

    private boolean withinTolerance(double actual, double target) {
        return Math.abs(actual - target) <= epsilonSeconds;
    }
}
