package com.sporewriter.rewrite;

import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Derived graph plus bookkeeping from one rewrite.
 */
@Getter
@AllArgsConstructor
public class RewriteResult {

    private final Graph graph;

    /**
     * RHS id to the input node created for it.
     */
    private final Map<NodeId, NodeId> createdNodes;

    private final RewriteStats stats;
}
