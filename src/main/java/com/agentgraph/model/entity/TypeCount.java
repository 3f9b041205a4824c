package com.agentgraph.model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row projection for per-type counts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TypeCount {
    private String type;
    private Long count;
}
