package com.agentgraph.model.dto;

import com.agentgraph.model.TypeOrigin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Input to the type registry, shared by the create-type operations and the seed catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeDefinition {
    private String name;
    private String description;
    private String justification;
    private Map<String, Object> propertiesSchema;
    private Map<String, Object> exampleProperties;

    @Builder.Default
    private TypeOrigin createdBy = TypeOrigin.AGENT;
}
