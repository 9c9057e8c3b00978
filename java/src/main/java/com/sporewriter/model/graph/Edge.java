package com.sporewriter.model.graph;

import lombok.Value;

/**
 * Edge as stored, in the orientation it was added with.
 */
@Value
public class Edge {
    NodeId source;
    NodeId target;

    public Edge reversed() {
        return new Edge(target, source);
    }
}
