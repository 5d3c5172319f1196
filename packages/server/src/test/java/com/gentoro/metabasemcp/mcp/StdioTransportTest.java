package com.gentoro.metabasemcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.TextNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class StdioTransportTest {

  @Test
  void answersRequestsLineByLine() throws Exception {
    ToolRegistry registry = new ToolRegistry();
    registry.register(
        new ToolDefinition(
            "hello", "Say hello.", SchemaBuilder.object().build(), args -> new TextNode("hi")));
    McpServer server = new McpServer(registry, "test");

    String input =
        String.join(
            "\n",
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}",
            "",
            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
            "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"hello\"}}");
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    new StdioTransport(
            server, new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out)
        .run();

    String[] lines = out.toString(StandardCharsets.UTF_8).trim().split("\\R");
    assertEquals(2, lines.length);
    assertTrue(lines[0].contains("\"id\":1"));
    assertTrue(lines[1].contains("\"id\":2"));
    assertTrue(lines[1].contains("\"text\":\"hi\""));
  }
}
