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
 * Notification recorded when an agent publishes advice. Delivery happens elsewhere.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("inbox_items")
public class InboxItem {

    @Id
    private UUID id;

    @Column("agent_id")
    private UUID agentId;

    @Column("node_id")
    private UUID nodeId;

    @Column("title")
    private String title;

    @Column("content")
    private String content;

    @Column("read")
    private boolean read;

    @Column("created_at")
    private LocalDateTime createdAt;
}
