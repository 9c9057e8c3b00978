package com.sporewriter.rewrite;

import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A rewrite rule applied at a match: LHS and RHS patterns, the match
 * (LHS to Input) and the correspondence (RHS to LHS).
 *
 * All ids must already be normalized.
 */
@Getter
public class RewriteRule {

    private final Graph lhs;
    private final Graph rhs;
    private final Map<NodeId, NodeId> match;
    private final Map<NodeId, NodeId> correspondence;

    /**
     * Inverse of the correspondence, restricted to RHS nodes present in the RHS graph.
     */
    private final Map<NodeId, List<NodeId>> lhsToRhs;

    public RewriteRule(Graph lhs, Graph rhs, Map<NodeId, NodeId> match, Map<NodeId, NodeId> correspondence) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.match = Collections.unmodifiableMap(new LinkedHashMap<>(match));
        this.correspondence = Collections.unmodifiableMap(new LinkedHashMap<>(correspondence));

        Map<NodeId, List<NodeId>> inverse = new LinkedHashMap<>();
        correspondence.forEach((rhsId, lhsId) -> {
            if (rhs.containsNode(rhsId)) {
                inverse.computeIfAbsent(lhsId, k -> new ArrayList<>()).add(rhsId);
            }
        });
        this.lhsToRhs = Collections.unmodifiableMap(inverse);
    }

    public Optional<NodeId> matchOf(NodeId lhsId) {
        return Optional.ofNullable(match.get(lhsId));
    }

    public Optional<NodeId> correspondenceOf(NodeId rhsId) {
        return Optional.ofNullable(correspondence.get(rhsId));
    }

    /**
     * RHS nodes that continue the given LHS node; empty when the rule deletes it.
     */
    public List<NodeId> rhsOf(NodeId lhsId) {
        return lhsToRhs.getOrDefault(lhsId, List.of());
    }

    /**
     * Input node an RHS node is preserved as, if its correspondence and match are both defined.
     */
    public Optional<NodeId> inputOf(NodeId rhsId) {
        return correspondenceOf(rhsId).flatMap(this::matchOf);
    }
}
