package com.github.stormino.trackdl.model;

/**
 * Policy applied when the destination file already exists.
 */
public enum ConflictResolution {
    OVERWRITE("overwrite"),
    SKIP("skip"),
    RENAME("rename"),
    OVERWRITE_IF_DIFFERENT("overwrite_if_different");

    private final String wireValue;

    ConflictResolution(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
