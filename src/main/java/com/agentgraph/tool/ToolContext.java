package com.agentgraph.tool;

import lombok.Value;

import java.util.UUID;

/**
 * Per-call context handed to every tool.
 */
@Value
public class ToolContext {
    UUID agentId;
}
