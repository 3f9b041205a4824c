package com.agentgraph.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for defining a new node type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeTypeCreateRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Description is required")
    private String description;

    @NotNull(message = "Properties schema is required")
    private Map<String, Object> propertiesSchema;

    @NotNull(message = "Example properties are required")
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
