package com.sporewriter.rewrite;

import com.sporewriter.exception.NoMorphismException;
import com.sporewriter.exception.UnmappedPatternNodeException;
import com.sporewriter.model.graph.Graph;
import com.sporewriter.model.graph.NodeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks that a match is a structure-preserving embedding of the LHS into the input graph.
 *
 * Every LHS edge must have an input edge between the matched nodes. In strict
 * mode the converse is checked too: two matched LHS nodes whose images are
 * adjacent in the input must be adjacent in the LHS. Edges are compared
 * without regard to orientation.
 */
@Slf4j
@Component
public class MorphismValidator {

    private final boolean strict;

    public MorphismValidator(@Value("${sporewriter.morphism.strict:true}") boolean strict) {
        this.strict = strict;
    }

    /**
     * Validate the match of {@code lhs} into {@code input}.
     *
     * @param input Input graph
     * @param lhs   Pattern graph
     * @param match LHS to Input mapping
     * @throws UnmappedPatternNodeException if an LHS node has no match entry
     * @throws NoMorphismException          if the match does not preserve structure
     */
    public void validate(Graph input, Graph lhs, Map<NodeId, NodeId> match) {
        for (NodeId lhsId : lhs.nodeIds()) {
            NodeId inputId = match.get(lhsId);
            if (inputId == null) {
                throw new UnmappedPatternNodeException(lhsId.raw());
            }
            if (!input.containsNode(inputId)) {
                throw new NoMorphismException("LHS node " + lhsId + " is matched to missing input node " + inputId);
            }

            Set<NodeId> inputNeighbors = input.neighbors(inputId);
            Set<NodeId> mappedLhsNeighbors = lhs.neighbors(lhsId).stream()
                    .map(match::get)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toSet());

            log.debug("LHS {} mapped to input {}: mapped LHS neighbors {}, input neighbors {}",
                    lhsId, inputId, mappedLhsNeighbors, inputNeighbors);

            if (!inputNeighbors.containsAll(mappedLhsNeighbors)) {
                throw new NoMorphismException("an edge at LHS node " + lhsId + " has no input counterpart");
            }

            if (strict) {
                checkNoExtraEdges(input, lhs, match, lhsId, inputId);
            }
        }
    }

    private void checkNoExtraEdges(Graph input, Graph lhs, Map<NodeId, NodeId> match,
                                   NodeId lhsId, NodeId inputId) {
        for (NodeId other : lhs.nodeIds()) {
            if (other.equals(lhsId)) {
                continue;
            }
            NodeId otherInput = match.get(other);
            if (otherInput != null && input.connected(inputId, otherInput) && !lhs.connected(lhsId, other)) {
                throw new NoMorphismException("input edge " + inputId + " -- " + otherInput
                        + " is absent between LHS nodes " + lhsId + " and " + other);
            }
        }
    }
}
