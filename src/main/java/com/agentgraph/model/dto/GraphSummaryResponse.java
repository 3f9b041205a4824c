package com.agentgraph.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Node and edge counts of an agent's graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphSummaryResponse {
    private long nodeCount;
    private long edgeCount;
    private Map<String, Long> nodesByType;
    private Map<String, Long> edgesByType;
}
