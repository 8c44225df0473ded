package com.example.embedstore;

/**
 * Thrown when a store file declares a format version this build cannot read.
 */
public class UnsupportedVersionException extends EmbeddingStoreException {

    private final int version;

    public UnsupportedVersionException(int version, int currentVersion) {
        super("Unsupported version: " + version + ". Current version is " + currentVersion);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
