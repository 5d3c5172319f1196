package com.gentoro.metabasemcp.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.ExceptionUtil;
import com.gentoro.metabasemcp.exception.MetabaseMcpException;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.Optional;

/**
 * Transport independent Model Context Protocol endpoint (JSON-RPC 2.0).
 *
 * <p>Supports {@code initialize}, {@code ping}, {@code tools/list}, {@code tools/call} and
 * ignores notifications. A failing tool is reported as a tool result with {@code isError: true}
 * and the text {@code Error in <tool>: <message>}; protocol problems (unknown method, unknown tool,
 * malformed request) become JSON-RPC errors.
 */
public class McpServer {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(McpServer.class);

  public static final String PROTOCOL_VERSION = "2025-06-18";
  public static final String SERVER_NAME = "metabase-mcp";

  static final int PARSE_ERROR = -32700;
  static final int INVALID_REQUEST = -32600;
  static final int METHOD_NOT_FOUND = -32601;
  static final int INVALID_PARAMS = -32602;
  static final int INTERNAL_ERROR = -32603;

  private final ToolRegistry registry;
  private final String version;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public McpServer(ToolRegistry registry, String version) {
    this.registry = registry;
    this.version = version;
  }

  /** Handle one raw JSON-RPC message; returns the serialized response, or null for notifications. */
  public String handle(String message) {
    JsonNode request;
    try {
      request = mapper.readTree(message);
    } catch (Exception e) {
      log.warn("Unparseable JSON-RPC message: {}", e.getMessage());
      return error(null, PARSE_ERROR, "Parse error").toString();
    }
    JsonNode response = handle(request);
    return response == null ? null : response.toString();
  }

  /** Handle one JSON-RPC request object; returns null for notifications. */
  public JsonNode handle(JsonNode request) {
    if (request == null || !request.isObject() || !request.path("method").isTextual()) {
      return error(request == null ? null : request.get("id"), INVALID_REQUEST, "Invalid request");
    }
    JsonNode id = request.get("id");
    String method = request.get("method").asText();
    JsonNode params = request.path("params");

    if (id == null) {
      log.debug("Notification {}", method);
      return null;
    }

    try {
      return switch (method) {
        case "initialize" -> result(id, initialize(params));
        case "ping" -> result(id, mapper.createObjectNode());
        case "tools/list" -> result(id, listTools());
        case "tools/call" -> callTool(id, params);
        default -> error(id, METHOD_NOT_FOUND, "Method not found: " + method);
      };
    } catch (Exception e) {
      log.error("Failed to handle {}", method, e);
      return error(id, INTERNAL_ERROR, ExceptionUtil.extractErrorMessage(e));
    }
  }

  private ObjectNode initialize(JsonNode params) {
    String requested = params.path("protocolVersion").asText(PROTOCOL_VERSION);
    log.info("Client initializing (requested protocol {})", requested);

    ObjectNode result = mapper.createObjectNode();
    result.put("protocolVersion", PROTOCOL_VERSION);
    ObjectNode capabilities = result.putObject("capabilities");
    capabilities.putObject("tools").put("listChanged", false);
    ObjectNode serverInfo = result.putObject("serverInfo");
    serverInfo.put("name", SERVER_NAME);
    serverInfo.put("version", version);
    return result;
  }

  private ObjectNode listTools() {
    ObjectNode result = mapper.createObjectNode();
    ArrayNode tools = result.putArray("tools");
    for (ToolDefinition tool : registry.list()) {
      ObjectNode entry = tools.addObject();
      entry.put("name", tool.name());
      entry.put("description", tool.description());
      entry.set("inputSchema", tool.inputSchema());
    }
    return result;
  }

  private JsonNode callTool(JsonNode id, JsonNode params) {
    String name = params.path("name").asText(null);
    if (name == null || name.isBlank()) {
      return error(id, INVALID_PARAMS, "Missing tool name");
    }
    Optional<ToolDefinition> tool = registry.find(name);
    if (tool.isEmpty()) {
      return error(id, INVALID_PARAMS, "Unknown tool: " + name);
    }

    log.info("Calling tool {}", name);
    log.debug("Arguments for {}: {}", name, params.path("arguments"));
    try {
      JsonNode output = tool.get().handler().handle(new ToolArguments(params.get("arguments")));
      return result(id, toolResult(render(output), false));
    } catch (Exception e) {
      String message = "Error in " + name + ": " + ExceptionUtil.extractErrorMessage(e);
      if (e instanceof MetabaseMcpException) {
        log.warn(
            "{} {} at {}",
            message,
            ((MetabaseMcpException) e).getContext(),
            ExceptionUtil.formatCompactStackTrace(e, 3));
      } else {
        log.error(message, e);
      }
      return result(id, toolResult(message, true));
    }
  }

  private String render(JsonNode output) throws Exception {
    if (output == null || output.isNull() || output.isMissingNode()) {
      return "null";
    }
    if (output.isTextual()) {
      return output.asText();
    }
    return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(output);
  }

  private ObjectNode toolResult(String text, boolean isError) {
    ObjectNode result = mapper.createObjectNode();
    ObjectNode content = result.putArray("content").addObject();
    content.put("type", "text");
    content.put("text", text);
    result.put("isError", isError);
    return result;
  }

  private ObjectNode result(JsonNode id, JsonNode result) {
    ObjectNode response = envelope(id);
    response.set("result", result);
    return response;
  }

  private ObjectNode error(JsonNode id, int code, String message) {
    ObjectNode response = envelope(id);
    ObjectNode error = response.putObject("error");
    error.put("code", code);
    error.put("message", message);
    return response;
  }

  private ObjectNode envelope(JsonNode id) {
    ObjectNode response = mapper.createObjectNode();
    response.put("jsonrpc", "2.0");
    if (id == null) {
      response.putNull("id");
    } else {
      response.set("id", id);
    }
    return response;
  }
}
