package github.sarthakdev143.reel_forge.model;

public enum MediaKind {
    AUDIO,
    VIDEO,
    IMAGE
}
