package com.agentgraph.model.dto;

import com.agentgraph.model.UpsertAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Result of writing an advice node and recording its notification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdviceResult {
    private UUID id;
    private UpsertAction action;
    private UUID notificationId;
}
