package com.agentgraph.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating or merge-updating a graph node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeUpsertRequest {

    @NotBlank(message = "Node type is required")
    private String type;

    @NotBlank(message = "Node name is required")
    private String name;

    private Map<String, Object> properties;
}
