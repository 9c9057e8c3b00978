package com.sporewriter.rewrite;

import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import com.sporewriter.model.graph.Position;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Creates input nodes for RHS-only nodes and places them.
 *
 * Each RHS node is materialized at most once; later requests return the
 * memoized input id. A new node is placed by translating the RHS displacement
 * between the node and its RHS anchor onto the input anchor.
 */
@Slf4j
public class PositionSynthesizer {

    private final Graph input;
    private final Graph rhs;
    private final IdentifierAllocator allocator;
    private final Map<NodeId, NodeId> materialized = new LinkedHashMap<>();

    public PositionSynthesizer(Graph input, Graph rhs, IdentifierAllocator allocator) {
        this.input = input;
        this.rhs = rhs;
        this.allocator = allocator;
    }

    /**
     * Return the input node for {@code rhsId}, creating it next to the anchors if needed.
     *
     * @param rhsId       RHS node to materialize
     * @param rhsAnchor   RHS reference node, or null
     * @param inputAnchor Input node playing the role of {@code rhsAnchor}, or null
     * @return Input node id
     */
    public NodeId materialize(NodeId rhsId, NodeId rhsAnchor, NodeId inputAnchor) {
        NodeId existing = materialized.get(rhsId);
        if (existing != null) {
            return existing;
        }
        Position position;
        if (rhsAnchor == null && inputAnchor == null) {
            position = Position.ORIGIN;
        } else {
            Position from = rhsAnchor != null ? rhs.position(rhsAnchor) : Position.ORIGIN;
            Position to = inputAnchor != null ? input.position(inputAnchor) : Position.ORIGIN;
            Position target = rhs.position(rhsId);
            position = to.plus(target.getX() - from.getX(), target.getY() - from.getY());
        }
        return create(rhsId, position, rhsAnchor, inputAnchor);
    }

    /**
     * Return the input node for {@code rhsId}, creating it at its own RHS coordinates if needed.
     */
    public NodeId materializeDetached(NodeId rhsId) {
        NodeId existing = materialized.get(rhsId);
        if (existing != null) {
            return existing;
        }
        return create(rhsId, rhs.position(rhsId), null, null);
    }

    public Optional<NodeId> lookup(NodeId rhsId) {
        return Optional.ofNullable(materialized.get(rhsId));
    }

    /**
     * RHS id to created input id, in creation order.
     */
    public Map<NodeId, NodeId> getMaterialized() {
        return Collections.unmodifiableMap(materialized);
    }

    private NodeId create(NodeId rhsId, Position position, NodeId rhsAnchor, NodeId inputAnchor) {
        NodeId id = allocator.allocate();
        if (input.containsNode(id)) {
            throw new IllegalStateException("Allocated node id " + id + " already exists in the input graph");
        }
        input.addNode(id, position);
        materialized.put(rhsId, id);
        log.info("Created input node {} from RHS {} (src rhs={}, input={}) at ({}, {})",
                id, rhsId, rhsAnchor, inputAnchor, position.getX(), position.getY());
        return id;
    }
}
