package github.sarthakdev143.reel_forge.service;

import github.sarthakdev143.reel_forge.model.AssetRef;

/**
 * @param durationSeconds probed duration of {@code ref}
 * @param modified        false when the source already matched and was returned as is
 */
public record AdjustmentResult(AssetRef ref, double durationSeconds, boolean modified) {
}
