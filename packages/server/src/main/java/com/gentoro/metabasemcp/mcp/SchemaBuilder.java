package com.gentoro.metabasemcp.mcp;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/** Fluent builder for the JSON Schema of a tool's arguments object. */
public final class SchemaBuilder {
  private final ObjectNode schema = JacksonUtility.nodes().objectNode();
  private final ObjectNode properties;
  private final ArrayNode required;

  private SchemaBuilder() {
    schema.put("type", "object");
    properties = schema.putObject("properties");
    required = schema.putArray("required");
  }

  public static SchemaBuilder object() {
    return new SchemaBuilder();
  }

  public SchemaBuilder required(String name, String type, String description) {
    property(name, type, description);
    required.add(name);
    return this;
  }

  public SchemaBuilder optional(String name, String type, String description) {
    property(name, type, description);
    return this;
  }

  public ObjectNode build() {
    return schema.deepCopy();
  }

  private void property(String name, String type, String description) {
    ObjectNode property = properties.putObject(name);
    property.put("type", type);
    property.put("description", description);
    if ("array".equals(type)) {
      property.putObject("items");
    }
  }
}
