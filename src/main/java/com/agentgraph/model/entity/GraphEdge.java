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
 * Directed, typed relationship between two nodes of the same agent. Written once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("graph_edges")
public class GraphEdge {

    @Id
    private UUID id;

    @Column("agent_id")
    private UUID agentId;

    @Column("type")
    private String type;

    @Column("source_id")
    private UUID sourceId;

    @Column("target_id")
    private UUID targetId;

    @Column("properties")
    private String properties; // JSON text

    @Column("created_at")
    private LocalDateTime createdAt;
}
