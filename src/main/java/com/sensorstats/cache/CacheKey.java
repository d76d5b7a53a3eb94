package com.sensorstats.cache;

/**
 * Canonical identity of a normalized query: SHA-256 hex digest of its canonical serialization.
 *
 * @param digest Lower-case hex digest
 */
public record CacheKey(String digest) {

    public CacheKey {
        if (digest == null || digest.isBlank()) throw new IllegalArgumentException("Digest must not be blank");
    }

    @Override
    public String toString() {
        return digest;
    }
}
