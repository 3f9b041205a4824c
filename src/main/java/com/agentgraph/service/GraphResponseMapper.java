package com.agentgraph.service;

import com.agentgraph.model.TypeKind;
import com.agentgraph.model.TypeOrigin;
import com.agentgraph.model.dto.EdgeResponse;
import com.agentgraph.model.dto.NodeResponse;
import com.agentgraph.model.dto.TypeResponse;
import com.agentgraph.model.entity.GraphEdge;
import com.agentgraph.model.entity.GraphNode;
import com.agentgraph.model.entity.GraphType;
import com.agentgraph.util.JsonCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Entity to response DTO conversion.
 */
@Component
@RequiredArgsConstructor
public class GraphResponseMapper {

    private final JsonCodec jsonCodec;

    public TypeResponse toResponse(GraphType type) {
        return TypeResponse.builder()
                .id(asString(type.getId()))
                .agentId(asString(type.getAgentId()))
                .kind(TypeKind.fromValue(type.getKind()))
                .name(type.getName())
                .description(type.getDescription())
                .justification(type.getJustification())
                .propertiesSchema(jsonCodec.readMap(type.getPropertiesSchema()))
                .exampleProperties(jsonCodec.readMap(type.getExampleProperties()))
                .createdBy(type.getCreatedBy() == null ? null : TypeOrigin.fromValue(type.getCreatedBy()))
                .createdAt(type.getCreatedAt())
                .build();
    }

    public NodeResponse toResponse(GraphNode node) {
        return NodeResponse.builder()
                .id(asString(node.getId()))
                .agentId(asString(node.getAgentId()))
                .type(node.getType())
                .name(node.getName())
                .properties(jsonCodec.readMap(node.getProperties()))
                .createdAt(node.getCreatedAt())
                .updatedAt(node.getUpdatedAt())
                .build();
    }

    public EdgeResponse toResponse(GraphEdge edge) {
        return EdgeResponse.builder()
                .id(asString(edge.getId()))
                .type(edge.getType())
                .sourceId(asString(edge.getSourceId()))
                .targetId(asString(edge.getTargetId()))
                .properties(jsonCodec.readMap(edge.getProperties()))
                .createdAt(edge.getCreatedAt())
                .build();
    }

    private static String asString(UUID id) {
        return id == null ? null : id.toString();
    }
}
