package com.sporewriter.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph in node-link form, used for both requests and responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphPayload {

    private boolean directed;

    private boolean multigraph;

    /**
     * Opaque metadata, passed through unchanged.
     */
    @Builder.Default
    @JsonProperty("graph")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Valid
    @Builder.Default
    @NotNull(message = "Nodes are required")
    private List<@NotNull NodePayload> nodes = new ArrayList<>();

    @Valid
    @Builder.Default
    @NotNull(message = "Links are required")
    private List<@NotNull LinkPayload> links = new ArrayList<>();
}
