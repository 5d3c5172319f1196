package com.gentoro.metabasemcp.mcp;

/** A group of related tools. */
public interface ToolProvider {
  void register(ToolRegistry registry);
}
