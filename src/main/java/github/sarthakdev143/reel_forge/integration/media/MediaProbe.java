package github.sarthakdev143.reel_forge.integration.media;

import github.sarthakdev143.reel_forge.model.AssetRef;
import github.sarthakdev143.reel_forge.model.ProbeResult;

/**
 * Reads duration and stream type of a stored asset. Failure is reported as {@code ok=false}, never thrown.
 */
public interface MediaProbe {

    ProbeResult probe(AssetRef ref);
}
