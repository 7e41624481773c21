package com.tessera.threads;

/**
 * @param branch the branch, now {@link ThreadStatus#MERGED}
 * @param summaryMessage the message appended to the parent thread
 * @param branchTerminalHash hash the branch ended with, embedded in the summary
 */
public record MergeResult(ChatThread branch, ThreadMessage summaryMessage, String branchTerminalHash) {}
