package com.sporewriter.rewrite;

import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import com.sporewriter.model.graph.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PositionSynthesizer.
 */
class PositionSynthesizerTest {

    private Graph input;
    private Graph rhs;
    private PositionSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        input = new Graph();
        input.addNode(NodeId.of(1), new Position(100.0, 50.0));

        rhs = new Graph();
        rhs.addNode(NodeId.token("a"), new Position(10.0, 10.0));
        rhs.addNode(NodeId.token("b"), new Position(13.0, 6.0));

        synthesizer = new PositionSynthesizer(input, rhs, new IdentifierAllocator(input));
    }

    @Test
    void materialize_TranslatesRhsDisplacementOntoInputAnchor() {
        NodeId created = synthesizer.materialize(NodeId.token("b"), NodeId.token("a"), NodeId.of(1));

        assertEquals(NodeId.of(2), created);
        assertEquals(new Position(103.0, 46.0), input.position(created));
    }

    @Test
    void materialize_IsMemoizedPerRhsNode() {
        NodeId first = synthesizer.materialize(NodeId.token("b"), NodeId.token("a"), NodeId.of(1));
        NodeId second = synthesizer.materialize(NodeId.token("b"), null, null);

        assertEquals(first, second);
        assertEquals(2, input.nodeCount());
        assertEquals(1, synthesizer.getMaterialized().size());
    }

    @Test
    void materialize_WithoutAnchorsPlacesAtOrigin() {
        NodeId created = synthesizer.materialize(NodeId.token("b"), null, null);

        assertEquals(Position.ORIGIN, input.position(created));
    }

    @Test
    void materializeDetached_UsesRawRhsCoordinates() {
        NodeId created = synthesizer.materializeDetached(NodeId.token("b"));

        assertEquals(new Position(13.0, 6.0), input.position(created));
        assertEquals(created, synthesizer.lookup(NodeId.token("b")).orElseThrow());
    }

    @Test
    void materialize_RefusesAllocatedIdAlreadyInInput() {
        IdentifierAllocator colliding = new IdentifierAllocator(input) {
            @Override
            public NodeId allocate() {
                return NodeId.of(1);
            }
        };
        PositionSynthesizer broken = new PositionSynthesizer(input, rhs, colliding);

        assertThrows(IllegalStateException.class,
                () -> broken.materialize(NodeId.token("b"), NodeId.token("a"), NodeId.of(1)));
        assertEquals(1, input.nodeCount());
        assertEquals(new Position(100.0, 50.0), input.position(NodeId.of(1)));
        assertTrue(broken.lookup(NodeId.token("b")).isEmpty());
    }
}
