package github.sarthakdev143.reel_forge.integration.media;

/**
 * Fade lengths in seconds; zero disables a fade.
 */
public record FadePlan(double fadeInSec, double fadeOutSec) {

    private static final double MAX_FADE_SECONDS = 1.0;

    public static FadePlan none() {
        return new FadePlan(0.0, 0.0);
    }

    /**
     * Fades span at most one second and at most a quarter of the output.
     */
    public static FadePlan forDuration(double outputSeconds, boolean fadeIn, boolean fadeOut) {
        double length = Math.min(MAX_FADE_SECONDS, outputSeconds / 4.0);
        return new FadePlan(fadeIn ? length : 0.0, fadeOut ? length : 0.0);
    }

    public boolean hasFades() {
        return fadeInSec > 0 || fadeOutSec > 0;
    }
}
