package com.agentgraph.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Response DTO for a graph edge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeResponse {
    private String id;
    private String type;
    private String sourceId;
    private String targetId;
    private Map<String, Object> properties;
    private LocalDateTime createdAt;
}
