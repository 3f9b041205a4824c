package com.agentgraph.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Parameter type of tools that take no arguments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmptyParams {
}
