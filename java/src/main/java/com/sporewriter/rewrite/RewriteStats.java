package com.sporewriter.rewrite;

import lombok.Data;

/**
 * Counters collected while applying a rule.
 */
@Data
public class RewriteStats {
    private int createdNodes;
    private int removedNodes;
    private int addedEdges;
    private int removedEdges;

    void nodeRemoved() {
        removedNodes++;
    }

    void edgeAdded() {
        addedEdges++;
    }

    void edgeRemoved() {
        removedEdges++;
    }
}
