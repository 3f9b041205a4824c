package com.agentgraph.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Node or edge type definition. A null agent id marks a global type shared by every agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("graph_types")
public class GraphType {

    @Id
    private UUID id;

    @Column("agent_id")
    private UUID agentId;

    @Column("kind")
    private String kind; // "node" or "edge"

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("justification")
    private String justification;

    @Column("properties_schema")
    private String propertiesSchema; // JSON text

    @Column("example_properties")
    private String exampleProperties; // JSON text

    @Column("created_by")
    private String createdBy;

    @Column("created_at")
    private LocalDateTime createdAt;
}
