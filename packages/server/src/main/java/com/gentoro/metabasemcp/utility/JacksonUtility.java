package com.gentoro.metabasemcp.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

/** Shared, preconfigured Jackson mapper. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static JsonNodeFactory nodes() {
    return JSON_MAPPER.getNodeFactory();
  }

  /** Parse a response body; empty input yields a JSON null node. */
  public static JsonNode toJsonNode(String body) throws java.io.IOException {
    if (body == null || body.isBlank()) {
      return NullNode.getInstance();
    }
    return JSON_MAPPER.readTree(body);
  }
}
