package github.sarthakdev143.reel_forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opaque reference to a stored binary asset. Only the storage collaborator interprets the value.
 */
public record AssetRef(@JsonValue String value) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AssetRef {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Asset reference must not be blank.");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
