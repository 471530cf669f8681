package com.sparkify.etl;

/**
 * Access key pair for the source and destination object store. The values are opaque:
 * they are handed to the session as-is and never logged.
 */
public final class StorageCredentials {

    private final String accessKeyId;
    private final String secretKey;

    public StorageCredentials(String accessKeyId, String secretKey) {
        this.accessKeyId = accessKeyId == null ? "" : accessKeyId;
        this.secretKey = secretKey == null ? "" : secretKey;
    }

    public String getAccessKeyId() {
        return accessKeyId;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public boolean isPresent() {
        return !accessKeyId.isEmpty() && !secretKey.isEmpty();
    }

    @Override
    public String toString() {
        return isPresent() ? "StorageCredentials[****]" : "StorageCredentials[none]";
    }
}
