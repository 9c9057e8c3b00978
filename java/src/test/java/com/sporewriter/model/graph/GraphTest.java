package com.sporewriter.model.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Graph.
 */
class GraphTest {

    private static final NodeId A = NodeId.of(1);
    private static final NodeId B = NodeId.of(2);
    private static final NodeId C = NodeId.of(3);

    private Graph path(boolean directed) {
        Graph graph = new Graph(directed, false, Map.of());
        graph.addNode(A, Position.ORIGIN);
        graph.addNode(B, new Position(1.0, 0.0));
        graph.addNode(C, new Position(2.0, 0.0));
        graph.addEdge(A, B);
        graph.addEdge(B, C);
        return graph;
    }

    @Test
    void addEdge_UndirectedCollapsesReverseEdge() {
        Graph graph = path(false);

        assertFalse(graph.addEdge(B, A));
        assertEquals(2, graph.edgeCount());
        assertTrue(graph.hasEdge(B, A));
    }

    @Test
    void addEdge_DirectedKeepsOrientation() {
        Graph graph = path(true);

        assertFalse(graph.hasEdge(B, A));
        assertTrue(graph.connected(B, A));
        assertTrue(graph.addEdge(B, A));
        assertEquals(3, graph.edgeCount());
        assertEquals(Set.of(B), graph.neighbors(A));
    }

    @Test
    void addEdge_MissingEndpointThrows() {
        Graph graph = path(false);

        assertThrows(IllegalArgumentException.class, () -> graph.addEdge(A, NodeId.of(99)));
    }

    @Test
    void removeNode_DropsIncidentEdges() {
        Graph graph = path(false);

        assertTrue(graph.removeNode(B));

        assertEquals(List.of(A, C), graph.nodeIds());
        assertEquals(0, graph.edgeCount());
        assertTrue(graph.neighbors(A).isEmpty());
        assertTrue(graph.neighbors(C).isEmpty());
        assertFalse(graph.removeNode(B));
    }

    @Test
    void removeNode_WithSelfLoop() {
        Graph graph = path(false);
        graph.addEdge(B, B);

        assertTrue(graph.removeNode(B));
        assertEquals(0, graph.edgeCount());
    }

    @Test
    void removeEdge_UndirectedEitherOrientation() {
        Graph graph = path(false);

        assertTrue(graph.removeEdge(B, A));
        assertFalse(graph.connected(A, B));
        assertEquals(1, graph.degree(B));
    }

    @Test
    void removeEdge_DirectedKeepsOppositeEdge() {
        Graph graph = path(true);
        graph.addEdge(B, A);

        assertTrue(graph.removeEdge(A, B));
        assertTrue(graph.connected(A, B));
        assertFalse(graph.removeEdge(A, B));
        assertTrue(graph.removeEdge(B, A));
        assertFalse(graph.connected(A, B));
    }

    @Test
    void copy_IsIndependent() {
        Graph graph = path(false);
        Graph copy = graph.copy();

        copy.removeNode(A);
        copy.addNode(NodeId.token("x"), Position.ORIGIN);

        assertEquals(3, graph.nodeCount());
        assertTrue(graph.hasEdge(A, B));
        assertFalse(graph.containsNode(NodeId.token("x")));
        assertEquals(new Position(1.0, 0.0), copy.position(B));
    }

    @Test
    void position_MissingNodeThrows() {
        assertThrows(IllegalArgumentException.class, () -> new Graph().position(A));
    }
}
