package com.gentoro.metabasemcp.mcp;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A tool exposed over MCP.
 *
 * @param inputSchema JSON Schema of the {@code arguments} object
 */
public record ToolDefinition(
    String name, String description, ObjectNode inputSchema, ToolHandler handler) {
  public ToolDefinition {
    Objects.requireNonNull(name, "name is required");
    Objects.requireNonNull(description, "description is required");
    Objects.requireNonNull(inputSchema, "inputSchema is required");
    Objects.requireNonNull(handler, "handler is required");
  }
}
