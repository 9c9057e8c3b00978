package com.sporewriter.rewrite;

import com.sporewriter.model.graph.Edge;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import com.sporewriter.model.graph.Position;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a rewrite rule to an input graph at a given match.
 *
 * <ol>
 *   <li>Matched LHS nodes with no RHS counterpart are removed with their edges.</li>
 *   <li>From every preserved node a breadth-first walk over the RHS creates the
 *       RHS-only nodes it reaches and adds the RHS edges it crosses.</li>
 *   <li>RHS nodes no walk reached are placed relative to the nearest preserved RHS node.</li>
 *   <li>LHS edges without an RHS counterpart are removed from the input.</li>
 * </ol>
 *
 * The match is not validated here; run {@link MorphismValidator} first.
 * The input graph is copied, never mutated.
 */
@Slf4j
@Component
public class RewriteEngine {

    public RewriteResult rewrite(Graph input, RewriteRule rule) {
        Graph working = input.copy();
        RewriteStats stats = new RewriteStats();
        PositionSynthesizer synthesizer =
                new PositionSynthesizer(working, rule.getRhs(), new IdentifierAllocator(working));
        Set<NodeId> reached = new HashSet<>();

        deleteUnpreservedNodes(working, rule, stats);

        for (NodeId lhsId : rule.getLhs().nodeIds()) {
            Optional<NodeId> inputId = rule.matchOf(lhsId);
            if (inputId.isEmpty() || rule.rhsOf(lhsId).isEmpty()) {
                continue;
            }
            if (!working.containsNode(inputId.get())) {
                log.warn("Skipping LHS {}: matched input node {} is not in the graph", lhsId, inputId.get());
                continue;
            }
            for (NodeId rhsStart : rule.rhsOf(lhsId)) {
                expand(working, rule, synthesizer, new Frontier(rhsStart, inputId.get()), reached, stats);
            }
        }

        placeOrphans(working, rule, synthesizer, reached, stats);
        deleteVanishedEdges(working, rule, stats);

        stats.setCreatedNodes(synthesizer.getMaterialized().size());
        return new RewriteResult(working, synthesizer.getMaterialized(), stats);
    }

    private void deleteUnpreservedNodes(Graph working, RewriteRule rule, RewriteStats stats) {
        for (NodeId lhsId : rule.getLhs().nodeIds()) {
            Optional<NodeId> inputId = rule.matchOf(lhsId);
            if (inputId.isEmpty() || !rule.rhsOf(lhsId).isEmpty()) {
                continue;
            }
            if (working.removeNode(inputId.get())) {
                stats.nodeRemoved();
                log.info("Removed input node {} (no RHS counterpart)", inputId.get());
            }
        }
    }

    /**
     * Walk the RHS breadth-first from {@code start}, keeping each RHS node paired
     * with the input node that plays its role.
     */
    private void expand(Graph working, RewriteRule rule, PositionSynthesizer synthesizer,
                        Frontier start, Set<NodeId> reached, RewriteStats stats) {
        Graph rhs = rule.getRhs();
        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(start);
        Set<NodeId> visited = new HashSet<>();

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (!visited.add(current.getRhs())) {
                continue;
            }
            reached.add(current.getRhs());
            log.debug("Expanding RHS {} at input {} (rhs degree={}, input degree={})",
                    current.getRhs(), current.getInput(),
                    rhs.degree(current.getRhs()), working.degree(current.getInput()));

            for (NodeId rhsNeighbor : rhs.neighbors(current.getRhs())) {
                Optional<NodeId> lhsNeighbor = rule.correspondenceOf(rhsNeighbor);
                NodeId inputNeighbor;
                if (lhsNeighbor.isEmpty()) {
                    inputNeighbor = synthesizer.materialize(rhsNeighbor, current.getRhs(), current.getInput());
                } else {
                    Optional<NodeId> mapped = rule.matchOf(lhsNeighbor.get());
                    if (mapped.isEmpty() || !working.containsNode(mapped.get())) {
                        continue;
                    }
                    inputNeighbor = mapped.get();
                }

                if (ensureEdge(working, current.getInput(), inputNeighbor)) {
                    stats.edgeAdded();
                    log.info("Added edge {} -> {} ({})", current.getInput(), inputNeighbor,
                            lhsNeighbor.isEmpty() ? "RHS-only neighbor" : "mapped neighbor");
                }
                if (!visited.contains(rhsNeighbor)) {
                    queue.add(new Frontier(rhsNeighbor, inputNeighbor));
                }
            }
        }
    }

    /**
     * Materialize every RHS node that no walk reached and that is not already
     * represented by a matched input node, then connect those nodes among themselves.
     */
    private void placeOrphans(Graph working, RewriteRule rule, PositionSynthesizer synthesizer,
                              Set<NodeId> reached, RewriteStats stats) {
        Graph rhs = rule.getRhs();
        List<NodeId> anchors = new ArrayList<>();
        for (NodeId rhsId : rhs.nodeIds()) {
            if (resolvedInput(working, rule, rhsId).isPresent()) {
                anchors.add(rhsId);
            }
        }

        Set<NodeId> orphans = new LinkedHashSet<>();
        for (NodeId rhsId : rhs.nodeIds()) {
            if (reached.contains(rhsId)
                    || resolvedInput(working, rule, rhsId).isPresent()
                    || synthesizer.lookup(rhsId).isPresent()) {
                continue;
            }
            Position at = rhs.position(rhsId);
            Optional<NodeId> nearest = anchors.stream()
                    .min(Comparator.comparingDouble(anchor -> rhs.position(anchor).distanceTo(at)));
            if (nearest.isPresent()) {
                NodeId inputAnchor = resolvedInput(working, rule, nearest.get()).orElseThrow();
                synthesizer.materialize(rhsId, nearest.get(), inputAnchor);
            } else {
                synthesizer.materializeDetached(rhsId);
            }
            orphans.add(rhsId);
            log.info("Placed orphan RHS node {} (anchor={})", rhsId, nearest.orElse(null));
        }

        for (Edge edge : rhs.edges()) {
            if (orphans.contains(edge.getSource()) && orphans.contains(edge.getTarget())) {
                NodeId source = synthesizer.lookup(edge.getSource()).orElseThrow();
                NodeId target = synthesizer.lookup(edge.getTarget()).orElseThrow();
                if (ensureEdge(working, source, target)) {
                    stats.edgeAdded();
                    log.info("Added edge {} -> {} (orphan component)", source, target);
                }
            }
        }
    }

    private void deleteVanishedEdges(Graph working, RewriteRule rule, RewriteStats stats) {
        Graph rhs = rule.getRhs();
        for (Edge edge : rule.getLhs().edges()) {
            Optional<NodeId> inU = rule.matchOf(edge.getSource());
            Optional<NodeId> inV = rule.matchOf(edge.getTarget());
            if (inU.isEmpty() || inV.isEmpty()) {
                continue;
            }

            boolean rhsHasEdge = false;
            for (NodeId ru : rule.rhsOf(edge.getSource())) {
                for (NodeId rv : rule.rhsOf(edge.getTarget())) {
                    if (rhs.connected(ru, rv)) {
                        rhsHasEdge = true;
                        break;
                    }
                }
                if (rhsHasEdge) {
                    break;
                }
            }

            if (!rhsHasEdge && (working.removeEdge(inU.get(), inV.get()) || working.removeEdge(inV.get(), inU.get()))) {
                stats.edgeRemoved();
                log.info("Removed input edge {} -- {} (LHS edge disappeared in RHS)", inU.get(), inV.get());
            }
        }
    }

    private Optional<NodeId> resolvedInput(Graph working, RewriteRule rule, NodeId rhsId) {
        return rule.inputOf(rhsId).filter(working::containsNode);
    }

    /**
     * Add {@code u -> v} unless the nodes are already joined in either orientation.
     */
    private boolean ensureEdge(Graph working, NodeId u, NodeId v) {
        if (working.connected(u, v)) {
            return false;
        }
        return working.addEdge(u, v);
    }

    @Value
    private static class Frontier {
        NodeId rhs;
        NodeId input;
    }
}
