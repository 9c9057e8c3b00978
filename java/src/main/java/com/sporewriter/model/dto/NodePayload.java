package com.sporewriter.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Node of a node-link graph. The id is an integer or a string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodePayload {

    @NotNull(message = "Node id is required")
    private Object id;

    private Double x;

    private Double y;
}
