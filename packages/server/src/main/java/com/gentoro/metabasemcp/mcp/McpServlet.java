package com.gentoro.metabasemcp.mcp;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * POST {@code /mcp}: one JSON-RPC message per request. Responses are plain JSON; notifications are
 * acknowledged with {@code 202 Accepted} and no body.
 */
public final class McpServlet extends HttpServlet {
  private final transient McpServer server;

  public McpServlet(McpServer server) {
    this.server = server;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String body = new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    if (body.isBlank()) {
      resp.sendError(400, "Empty request body");
      return;
    }

    String response = server.handle(body);
    if (response == null) {
      resp.setStatus(202);
      return;
    }
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(response);
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setHeader("Allow", "POST");
    resp.sendError(405, "Server-initiated streams are not supported; POST JSON-RPC messages");
  }
}
