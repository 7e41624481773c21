package com.tessera.eventmodel.payload;

import java.util.ArrayList;
import java.util.List;

/**
 * Data of {@code threads.*.completed}, the audit record of a thread being created, branched or
 * merged.
 *
 * @param threadId the thread created or merged
 * @param parentThreadId parent thread for branches and merges
 * @param messageId branch point for branches, summary message for merges
 * @param terminalHash hash the branch ended with (merges only)
 */
public record ThreadCompletedPayload(
        String threadId, String parentThreadId, String messageId, String terminalHash)
        implements EventPayload {

    @Override
    public List<String> violations() {
        var errors = new ArrayList<String>();
        PayloadChecks.requireText(errors, "threadId", threadId);
        return errors;
    }
}
