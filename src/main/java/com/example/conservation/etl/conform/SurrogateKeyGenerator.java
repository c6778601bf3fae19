package com.example.conservation.etl.conform;

import com.example.conservation.etl.model.EntityType;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives stable keys from natural keys: the first 8 bytes of SHA-256 over
 * {@code entity:naturalKey}, masked to a positive long. The same natural key always
 * yields the same key, across runs and machines.
 */
public final class SurrogateKeyGenerator {

    private SurrogateKeyGenerator() {
    }

    public static long keyFor(EntityType entityType, String naturalKey) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] hash = digest.digest((entityType.name() + ":" + naturalKey).getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong() & Long.MAX_VALUE;
    }
}
