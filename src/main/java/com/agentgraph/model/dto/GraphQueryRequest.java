package com.agentgraph.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for querying an agent's graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphQueryRequest {

    private String nodeType;

    private String searchTerm;

    @Min(value = 1, message = "Limit must be at least 1")
    @Max(value = 100, message = "Limit cannot exceed 100")
    private Integer limit;
}
