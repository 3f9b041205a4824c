package com.agentgraph.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for analysis and advice nodes. Properties are checked against the seeded
 * AgentAnalysis / AgentAdvice schemas, and their content against the graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DerivedNodeRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotNull(message = "Properties are required")
    private Map<String, Object> properties;
}
