package com.agentgraph.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Nodes matching a graph query plus every edge incident to them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphQueryResponse {
    private List<NodeResponse> nodes;
    private List<EdgeResponse> edges;
}
