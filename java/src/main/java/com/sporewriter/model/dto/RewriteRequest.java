package com.sporewriter.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request DTO for applying a rewrite rule to an input graph.
 *
 * Mapping keys arrive as JSON object keys and are therefore always strings;
 * values may be integers or strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RewriteRequest {

    @Builder.Default
    @JsonProperty("mapping_lhs_to_input")
    private Map<String, Object> mappingLhsToInput = new LinkedHashMap<>();

    @Builder.Default
    @JsonProperty("mapping_rhs_to_lhs")
    private Map<String, Object> mappingRhsToLhs = new LinkedHashMap<>();

    @Valid
    @NotNull(message = "Input graph is required")
    @JsonProperty("graph_input")
    private GraphPayload graphInput;

    @Valid
    @NotNull(message = "LHS graph is required")
    @JsonProperty("graph_lhs")
    private GraphPayload graphLhs;

    @Valid
    @NotNull(message = "RHS graph is required")
    @JsonProperty("graph_rhs")
    private GraphPayload graphRhs;
}
