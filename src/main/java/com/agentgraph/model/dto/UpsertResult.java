package com.agentgraph.model.dto;

import com.agentgraph.model.UpsertAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Result of a node or edge upsert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertResult {
    private UUID id;
    private UpsertAction action;

    public static UpsertResult of(UUID id, UpsertAction action) {
        return new UpsertResult(id, action);
    }
}
