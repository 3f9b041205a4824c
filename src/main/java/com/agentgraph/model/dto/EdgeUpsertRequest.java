package com.agentgraph.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for creating a graph edge between two named nodes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeUpsertRequest {

    @NotBlank(message = "Edge type is required")
    private String type;

    @NotBlank(message = "Source type is required")
    private String sourceType;

    @NotBlank(message = "Source name is required")
    private String sourceName;

    @NotBlank(message = "Target type is required")
    private String targetType;

    @NotBlank(message = "Target name is required")
    private String targetName;

    private Map<String, Object> properties;
}
