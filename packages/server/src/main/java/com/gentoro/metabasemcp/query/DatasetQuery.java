package com.gentoro.metabasemcp.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/** Outer {@code dataset_query} envelope sent to {@code /dataset} and stored on cards. */
public final class DatasetQuery {
  public static final String TYPE_QUERY = "query";
  public static final String TYPE_NATIVE = "native";

  private DatasetQuery() {}

  /** {@code {"database": id, "type": "query", "query": {...}}}. */
  public static ObjectNode structured(long databaseId, ObjectNode query) {
    ObjectNode node = JacksonUtility.nodes().objectNode();
    node.put("database", databaseId);
    node.put("type", TYPE_QUERY);
    node.set("query", query);
    return node;
  }

  /**
   * {@code {"database": id, "type": "native", "native": {"query": sql, "parameters": [...]}}};
   * parameters are omitted when null or empty.
   */
  public static ObjectNode nativeQuery(long databaseId, String sql, JsonNode parameters) {
    ObjectNode node = JacksonUtility.nodes().objectNode();
    node.put("database", databaseId);
    node.put("type", TYPE_NATIVE);
    ObjectNode nativePart = node.putObject("native");
    nativePart.put("query", sql);
    if (parameters != null && parameters.isArray() && !parameters.isEmpty()) {
      nativePart.set("parameters", parameters.deepCopy());
    }
    return node;
  }
}
