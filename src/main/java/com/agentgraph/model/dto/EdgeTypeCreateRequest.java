package com.agentgraph.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for defining a new edge type. The schema is optional for edges.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeTypeCreateRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Description is required")
    private String description;

    private Map<String, Object> propertiesSchema;

    private Map<String, Object> exampleProperties;

    @NotBlank(message = "Justification is required")
    private String justification;

    public TypeDefinition toDefinition() {
        return TypeDefinition.builder()
                .name(name)
                .description(description)
                .justification(justification)
                .propertiesSchema(propertiesSchema)
                .exampleProperties(exampleProperties)
                .build();
    }
}
