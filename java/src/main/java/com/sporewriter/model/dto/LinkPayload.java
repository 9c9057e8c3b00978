package com.sporewriter.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Link of a node-link graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkPayload {

    @NotNull(message = "Link source is required")
    private Object source;

    @NotNull(message = "Link target is required")
    private Object target;
}
