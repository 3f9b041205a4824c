package com.agentgraph.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Response DTO for a graph node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeResponse {
    private String id;
    private String agentId;
    private String type;
    private String name;
    private Map<String, Object> properties;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
