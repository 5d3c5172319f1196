package com.gentoro.metabasemcp.mcp;

import com.gentoro.metabasemcp.exception.StateException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Tools by name, in registration order. Registering a name twice is an error. */
public class ToolRegistry {
  private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();

  public synchronized ToolRegistry register(ToolDefinition tool) {
    if (tools.containsKey(tool.name())) {
      throw new StateException("Tool already registered: " + tool.name());
    }
    tools.put(tool.name(), tool);
    return this;
  }

  public ToolRegistry registerAll(ToolProvider... providers) {
    for (ToolProvider provider : providers) {
      provider.register(this);
    }
    return this;
  }

  public synchronized Optional<ToolDefinition> find(String name) {
    return Optional.ofNullable(tools.get(name));
  }

  public synchronized List<ToolDefinition> list() {
    return new ArrayList<>(tools.values());
  }
}
