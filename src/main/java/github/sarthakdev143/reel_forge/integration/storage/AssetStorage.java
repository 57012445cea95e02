package github.sarthakdev143.reel_forge.integration.storage;

import github.sarthakdev143.reel_forge.model.AssetRef;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Write/read of opaque binary assets by reference.
 */
public interface AssetStorage {

    AssetRef put(byte[] content, String extension) throws IOException;

    byte[] get(AssetRef ref) throws IOException;

    /**
     * Stores the file at {@code source} and returns its reference. The source file is left untouched.
     */
    AssetRef putFile(Path source) throws IOException;

    /**
     * Resolves a reference to a readable local file for media tooling.
     */
    Path localPath(AssetRef ref) throws IOException;
}
