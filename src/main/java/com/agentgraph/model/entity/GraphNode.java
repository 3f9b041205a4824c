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
 * Graph node, unique per (agent, type, name).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("graph_nodes")
public class GraphNode {

    @Id
    private UUID id;

    @Column("agent_id")
    private UUID agentId;

    @Column("type")
    private String type;

    @Column("name")
    private String name;

    @Column("properties")
    private String properties; // JSON text

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
