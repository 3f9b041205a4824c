package com.agentgraph.model.dto;

import com.agentgraph.model.TypeKind;
import com.agentgraph.model.TypeOrigin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Response DTO for a node or edge type definition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeResponse {
    private String id;
    private String agentId;
    private TypeKind kind;
    private String name;
    private String description;
    private String justification;
    private Map<String, Object> propertiesSchema;
    private Map<String, Object> exampleProperties;
    private TypeOrigin createdBy;
    private LocalDateTime createdAt;
}
