package com.story.knowledge.core.model;

import com.story.knowledge.core.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digest of story element content, hex encoded.
 * Identical content always yields the same hash, across processes and versions,
 * so the hash doubles as an idempotency token.
 *
 * @param value lowercase hex digest
 */
public record ContentHash(String value) {

    private static final String ALGORITHM = "SHA-256";
    private static final int HEX_LENGTH = 64;

    public ContentHash {
        if (value == null || value.length() != HEX_LENGTH || !value.matches("^[0-9a-f]+$")) {
            throw new ValidationException("Content hash must be a 64 character lowercase hex digest, got: " + value);
        }
    }

    /**
     * Computes the canonical hash of the given content.
     *
     * @throws ValidationException if content is null
     */
    public static ContentHash of(String content) {
        if (content == null) {
            throw new ValidationException("Content must not be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return new ContentHash(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            // every JVM is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
