package github.sarthakdev143.reel_forge.model;

public record ProbeResult(
        double durationSeconds,
        MediaKind kind,
        boolean ok) {

    public static ProbeResult of(double durationSeconds, MediaKind kind) {
        return new ProbeResult(durationSeconds, kind, true);
    }

    public static ProbeResult failed() {
        return new ProbeResult(Double.NaN, null, false);
    }
}
