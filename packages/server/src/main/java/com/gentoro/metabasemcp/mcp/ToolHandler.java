package com.gentoro.metabasemcp.mcp;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of a tool. A textual result is returned to the client verbatim; any other document is
 * rendered as JSON.
 */
@FunctionalInterface
public interface ToolHandler {
  JsonNode handle(ToolArguments arguments) throws Exception;
}
