package com.sporewriter.service;

import com.sporewriter.model.dto.GraphPayload;
import com.sporewriter.model.dto.RewriteRequest;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import com.sporewriter.rewrite.MorphismValidator;
import com.sporewriter.rewrite.RewriteEngine;
import com.sporewriter.rewrite.RewriteResult;
import com.sporewriter.rewrite.RewriteRule;
import com.sporewriter.rewrite.RewriteStats;
import com.sporewriter.util.GraphPayloadMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Service applying a rewrite rule described by a request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewriteService {

    private final MorphismValidator morphismValidator;
    private final RewriteEngine rewriteEngine;

    /**
     * Rewrite the request's input graph.
     *
     * @param request Graphs and mappings
     * @return Derived graph, or an error if the request is malformed or the match is not a morphism
     */
    public Mono<GraphPayload> calculate(RewriteRequest request) {
        return Mono.fromCallable(() -> rewrite(request))
                .doOnError(error -> log.debug("Rewrite failed", error));
    }

    /**
     * Synchronous rewrite; nothing is returned unless every step succeeds.
     */
    public GraphPayload rewrite(RewriteRequest request) {
        logRequest(request);

        Graph input = GraphPayloadMapper.toGraph("input", request.getGraphInput());
        Graph lhs = GraphPayloadMapper.toGraph("lhs", request.getGraphLhs());
        Graph rhs = GraphPayloadMapper.toGraph("rhs", request.getGraphRhs());

        Map<NodeId, NodeId> match = GraphPayloadMapper.toMapping("mapping_lhs_to_input", request.getMappingLhsToInput());
        Map<NodeId, NodeId> correspondence = GraphPayloadMapper.toMapping("mapping_rhs_to_lhs", request.getMappingRhsToLhs());
        log.info("Normalized mappings sizes: lhs->input={} rhs->lhs={}", match.size(), correspondence.size());

        morphismValidator.validate(input, lhs, match);

        RewriteResult result = rewriteEngine.rewrite(input, new RewriteRule(lhs, rhs, match, correspondence));

        Graph output = result.getGraph();
        RewriteStats stats = result.getStats();
        log.info("Result: nodes={} edges={} | created_nodes={} removed_nodes={} added_edges={} removed_edges={}",
                output.nodeCount(), output.edgeCount(),
                stats.getCreatedNodes(), stats.getRemovedNodes(), stats.getAddedEdges(), stats.getRemovedEdges());

        return GraphPayloadMapper.toPayload(output);
    }

    private void logRequest(RewriteRequest request) {
        log.info("Request: input nodes={} edges={} | lhs nodes={} edges={} | rhs nodes={} edges={}",
                nodeCount(request.getGraphInput()), linkCount(request.getGraphInput()),
                nodeCount(request.getGraphLhs()), linkCount(request.getGraphLhs()),
                nodeCount(request.getGraphRhs()), linkCount(request.getGraphRhs()));
        log.info("Mappings: lhs->input={} rhs->lhs={}",
                size(request.getMappingLhsToInput()), size(request.getMappingRhsToLhs()));
        log.debug("lhs->input: {}", request.getMappingLhsToInput());
        log.debug("rhs->lhs: {}", request.getMappingRhsToLhs());
    }

    private static int nodeCount(GraphPayload graph) {
        return graph == null || graph.getNodes() == null ? 0 : graph.getNodes().size();
    }

    private static int linkCount(GraphPayload graph) {
        return graph == null || graph.getLinks() == null ? 0 : graph.getLinks().size();
    }

    private static int size(Map<?, ?> map) {
        return map == null ? 0 : map.size();
    }
}
