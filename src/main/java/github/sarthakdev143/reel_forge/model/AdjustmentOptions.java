package github.sarthakdev143.reel_forge.model;

/**
 * @param preservePitch applies to audio time-stretching only; for video it governs the clip's own audio track
 */
public record AdjustmentOptions(
        boolean fadeIn,
        boolean fadeOut,
        boolean preservePitch) {

    public static AdjustmentOptions fadeOutPreservingPitch() {
        return new AdjustmentOptions(false, true, true);
    }

    public static AdjustmentOptions plain() {
        return new AdjustmentOptions(false, false, true);
    }
}
