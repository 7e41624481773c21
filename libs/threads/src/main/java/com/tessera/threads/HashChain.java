package com.tessera.threads;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Message hashing and chain verification.
 *
 * <p>Verification walks the chain from the seed and feeds each recomputed hash into the next
 * message, so one altered message invalidates every message after it, not only itself.
 */
public final class HashChain {

    private HashChain() {
        // utility class
    }

    public static String hash(String messageId, String content, String previousHash) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        digest.update(messageId.getBytes(StandardCharsets.UTF_8));
        digest.update(content.getBytes(StandardCharsets.UTF_8));
        digest.update(previousHash.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest.digest());
    }

    /** The hashes the messages should carry, in order, starting from {@code seedHash}. */
    public static List<String> recompute(String seedHash, List<ThreadMessage> messages) {
        List<String> hashes = new ArrayList<>(messages.size());
        String previous = seedHash;
        for (ThreadMessage message : messages) {
            previous = hash(message.id(), message.content(), previous);
            hashes.add(previous);
        }
        return hashes;
    }

    public static ChainVerification verify(String seedHash, List<ThreadMessage> messages) {
        String previous = seedHash;
        int checked = 0;
        for (ThreadMessage message : messages) {
            checked++;
            String expected = hash(message.id(), message.content(), previous);
            if (!message.previousHash().equals(previous) || !message.hash().equals(expected)) {
                return ChainVerification.brokenAt(message.id(), checked);
            }
            previous = expected;
        }
        return ChainVerification.intact(checked);
    }
}
