package com.sporewriter.rewrite;

import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;

import java.math.BigInteger;

/**
 * Issues fresh numeric node ids above every numeric id of the input graph.
 *
 * Ids are unbounded integers, so the counter never wraps. One allocator serves
 * a single rewrite; ids are never reused within it.
 */
public class IdentifierAllocator {

    private BigInteger next;

    public IdentifierAllocator(Graph input) {
        BigInteger max = null;
        for (NodeId id : input.nodeIds()) {
            if (id.isNumeric() && (max == null || id.numericValue().compareTo(max) > 0)) {
                max = id.numericValue();
            }
        }
        this.next = max != null ? max.add(BigInteger.ONE) : BigInteger.ONE;
    }

    public NodeId allocate() {
        NodeId id = NodeId.of(next);
        next = next.add(BigInteger.ONE);
        return id;
    }
}
