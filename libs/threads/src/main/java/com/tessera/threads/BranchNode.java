package com.tessera.threads;

import java.util.List;

/** A thread and its branches, assembled by id lookup. */
public record BranchNode(ChatThread thread, List<BranchNode> branches) {

    public BranchNode {
        branches = List.copyOf(branches);
    }

    /** Threads in this subtree, this one included. */
    public int size() {
        return 1 + branches.stream().mapToInt(BranchNode::size).sum();
    }
}
