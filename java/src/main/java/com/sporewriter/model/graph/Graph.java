package com.sporewriter.model.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simple graph with positioned nodes, backed by a node table and adjacency sets.
 *
 * Edges keep the orientation they were added with. Connectivity queries
 * ({@link #neighbors}, {@link #connected}) ignore orientation, so a directed
 * graph answers them as its underlying undirected graph. Repeated edges
 * collapse. Iteration follows insertion order.
 */
public class Graph {

    private final boolean directed;
    private final boolean multigraph;
    private final Map<String, Object> attributes;

    private final Map<NodeId, Position> nodes = new LinkedHashMap<>();
    private final Map<NodeId, Set<NodeId>> adjacency = new LinkedHashMap<>();
    private final Set<Edge> edges = new LinkedHashSet<>();

    public Graph() {
        this(false, false, Map.of());
    }

    public Graph(boolean directed, boolean multigraph, Map<String, Object> attributes) {
        this.directed = directed;
        this.multigraph = multigraph;
        this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
    }

    public boolean isDirected() {
        return directed;
    }

    public boolean isMultigraph() {
        return multigraph;
    }

    /**
     * Free-form graph metadata, carried through unchanged.
     */
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Add a node, or move it if it already exists.
     */
    public void addNode(NodeId id, Position position) {
        nodes.put(id, position != null ? position : Position.ORIGIN);
        adjacency.computeIfAbsent(id, k -> new LinkedHashSet<>());
    }

    public boolean containsNode(NodeId id) {
        return nodes.containsKey(id);
    }

    public Position position(NodeId id) {
        Position position = nodes.get(id);
        if (position == null) {
            throw new IllegalArgumentException("Node " + id + " does not exist");
        }
        return position;
    }

    /**
     * Remove a node and every edge incident to it.
     *
     * @return true if the node existed
     */
    public boolean removeNode(NodeId id) {
        if (!nodes.containsKey(id)) {
            return false;
        }
        for (NodeId neighbor : new ArrayList<>(adjacency.get(id))) {
            adjacency.get(neighbor).remove(id);
        }
        edges.removeIf(e -> e.getSource().equals(id) || e.getTarget().equals(id));
        adjacency.remove(id);
        nodes.remove(id);
        return true;
    }

    /**
     * Add an edge. On an undirected graph an edge stored in the opposite
     * orientation counts as the same edge.
     *
     * @return true if the edge was not already present
     * @throws IllegalArgumentException if either endpoint does not exist
     */
    public boolean addEdge(NodeId source, NodeId target) {
        if (!containsNode(source) || !containsNode(target)) {
            throw new IllegalArgumentException("Edge " + source + " -> " + target + " references a missing node");
        }
        if (hasEdge(source, target)) {
            return false;
        }
        edges.add(new Edge(source, target));
        adjacency.get(source).add(target);
        adjacency.get(target).add(source);
        return true;
    }

    /**
     * Whether the edge {@code source -> target} exists, respecting orientation
     * on directed graphs.
     */
    public boolean hasEdge(NodeId source, NodeId target) {
        Edge edge = new Edge(source, target);
        if (edges.contains(edge)) {
            return true;
        }
        return !directed && edges.contains(edge.reversed());
    }

    /**
     * Whether the two nodes are joined by an edge in either orientation.
     */
    public boolean connected(NodeId u, NodeId v) {
        Set<NodeId> around = adjacency.get(u);
        return around != null && around.contains(v);
    }

    /**
     * Remove the edge {@code source -> target}.
     *
     * @return true if an edge was removed
     */
    public boolean removeEdge(NodeId source, NodeId target) {
        Edge edge = new Edge(source, target);
        boolean removed = edges.remove(edge) || (!directed && edges.remove(edge.reversed()));
        if (removed && !edges.contains(edge) && !edges.contains(edge.reversed())) {
            adjacency.get(source).remove(target);
            adjacency.get(target).remove(source);
        }
        return removed;
    }

    /**
     * Nodes adjacent to {@code id} in either orientation.
     */
    public Set<NodeId> neighbors(NodeId id) {
        Set<NodeId> around = adjacency.get(id);
        if (around == null) {
            throw new IllegalArgumentException("Node " + id + " does not exist");
        }
        return Collections.unmodifiableSet(around);
    }

    public int degree(NodeId id) {
        return neighbors(id).size();
    }

    /**
     * Snapshot of the node ids, safe to iterate while mutating the graph.
     */
    public List<NodeId> nodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    /**
     * Snapshot of the edges, safe to iterate while mutating the graph.
     */
    public List<Edge> edges() {
        return new ArrayList<>(edges);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Independent copy with the same flags, attributes, nodes and edges.
     */
    public Graph copy() {
        Graph copy = new Graph(directed, multigraph, attributes);
        nodes.forEach(copy::addNode);
        edges.forEach(e -> copy.addEdge(e.getSource(), e.getTarget()));
        return copy;
    }
}
