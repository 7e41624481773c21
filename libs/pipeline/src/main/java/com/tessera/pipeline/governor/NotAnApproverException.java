package com.tessera.pipeline.governor;

import java.util.UUID;

/** A user tried to decide a proposal they are not listed as approver of. */
public class NotAnApproverException extends RuntimeException {

    public NotAnApproverException(UUID pendingEventId, String userId) {
        super("User " + userId + " may not decide proposal " + pendingEventId);
    }
}
