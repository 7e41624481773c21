package com.tessera.pipeline.storage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** Content checksums in the {@code sha256:<hex>} form stored on rows and completion events. */
public final class Checksums {

    public static final String PREFIX = "sha256:";

    private Checksums() {
        // utility class
    }

    public static String sha256(byte[] content) {
        try {
            return PREFIX + HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
