package com.gentoro.metabasemcp.mcp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Newline-delimited JSON-RPC over a pair of streams (stdin/stdout in production). Blocks until the
 * input ends. Nothing but responses may be written to the output stream.
 */
public class StdioTransport {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(StdioTransport.class);

  private final McpServer server;
  private final InputStream in;
  private final OutputStream out;

  public StdioTransport(McpServer server, InputStream in, OutputStream out) {
    this.server = server;
    this.in = in;
    this.out = out;
  }

  public void run() throws IOException {
    log.info("Serving MCP over stdio");
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    PrintWriter writer =
        new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), false);
    String line;
    while ((line = reader.readLine()) != null) {
      if (line.isBlank()) {
        continue;
      }
      String response = server.handle(line);
      if (response != null) {
        writer.println(response);
        writer.flush();
      }
    }
    log.info("stdin closed, stopping stdio transport");
  }
}
