package com.sporewriter.util;

import com.sporewriter.exception.MalformedGraphException;
import com.sporewriter.model.dto.GraphPayload;
import com.sporewriter.model.dto.LinkPayload;
import com.sporewriter.model.dto.NodePayload;
import com.sporewriter.model.graph.Edge;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import com.sporewriter.model.graph.Position;
import com.sporewriter.rewrite.IdentifierNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for converting between node-link payloads and graphs.
 *
 * Every identifier is normalized on the way in.
 */
public class GraphPayloadMapper {

    private GraphPayloadMapper() {
    }

    /**
     * Build a graph from its node-link form.
     *
     * @param name    Graph name used in error messages (e.g. "input")
     * @param payload Node-link payload
     * @return Graph with normalized ids
     * @throws MalformedGraphException on null or duplicate ids, or links to unknown nodes
     */
    public static Graph toGraph(String name, GraphPayload payload) {
        if (payload == null) {
            throw new MalformedGraphException(name, "graph is missing");
        }
        Graph graph = new Graph(payload.isDirected(), payload.isMultigraph(), payload.getMetadata());

        for (NodePayload node : nullSafe(payload.getNodes())) {
            NodeId id = normalize(name, node == null ? null : node.getId(), "node id");
            if (graph.containsNode(id)) {
                throw new MalformedGraphException(name, "duplicate node id " + id);
            }
            graph.addNode(id, Position.of(node.getX(), node.getY()));
        }

        for (LinkPayload link : nullSafe(payload.getLinks())) {
            if (link == null) {
                throw new MalformedGraphException(name, "null link");
            }
            NodeId source = normalize(name, link.getSource(), "link source");
            NodeId target = normalize(name, link.getTarget(), "link target");
            if (!graph.containsNode(source) || !graph.containsNode(target)) {
                throw new MalformedGraphException(name,
                        "link " + source + " -> " + target + " references a missing node");
            }
            graph.addEdge(source, target);
        }
        return graph;
    }

    /**
     * Convert a graph back to node-link form, flags and metadata included.
     */
    public static GraphPayload toPayload(Graph graph) {
        List<NodePayload> nodes = new ArrayList<>();
        for (NodeId id : graph.nodeIds()) {
            Position position = graph.position(id);
            nodes.add(NodePayload.builder()
                    .id(id.raw())
                    .x(position.getX())
                    .y(position.getY())
                    .build());
        }

        List<LinkPayload> links = new ArrayList<>();
        for (Edge edge : graph.edges()) {
            links.add(LinkPayload.builder()
                    .source(edge.getSource().raw())
                    .target(edge.getTarget().raw())
                    .build());
        }

        return GraphPayload.builder()
                .directed(graph.isDirected())
                .multigraph(graph.isMultigraph())
                .metadata(new LinkedHashMap<>(graph.getAttributes()))
                .nodes(nodes)
                .links(links)
                .build();
    }

    /**
     * Normalize both sides of a mapping. Keys colliding after normalization keep the last value.
     *
     * @param name Mapping name used in error messages
     * @param raw  Raw mapping, may be null
     * @return Normalized mapping in request order
     * @throws MalformedGraphException if a value is null
     */
    public static Map<NodeId, NodeId> toMapping(String name, Map<String, Object> raw) {
        Map<NodeId, NodeId> mapping = new LinkedHashMap<>();
        if (raw == null) {
            return mapping;
        }
        raw.forEach((key, value) -> mapping.put(
                normalize(name, key, "mapping key"),
                normalize(name, value, "mapping value for " + key)));
        return mapping;
    }

    private static NodeId normalize(String name, Object raw, String what) {
        if (raw == null) {
            throw new MalformedGraphException(name, what + " is null");
        }
        return IdentifierNormalizer.normalize(raw);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
