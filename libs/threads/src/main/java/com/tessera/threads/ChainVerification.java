package com.tessera.threads;

/**
 * Result of replaying a thread's chain.
 *
 * @param valid every stored hash was reproduced
 * @param brokenAtMessageId first message whose hash did not match, null when valid
 * @param checkedMessages messages examined, including the broken one
 */
public record ChainVerification(boolean valid, String brokenAtMessageId, int checkedMessages) {

    public static ChainVerification intact(int checkedMessages) {
        return new ChainVerification(true, null, checkedMessages);
    }

    public static ChainVerification brokenAt(String messageId, int checkedMessages) {
        return new ChainVerification(false, messageId, checkedMessages);
    }
}
