package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Small helpers shared by the dashboard views. */
final class Documents {
  private Documents() {}

  static Long longOrNull(JsonNode node) {
    return node != null && node.isIntegralNumber() ? node.asLong() : null;
  }

  static String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }

  /** Objects of an array field, each deep-copied and wrapped; non-object entries are skipped. */
  static <T> List<T> objects(JsonNode array, Function<ObjectNode, T> wrapper) {
    List<T> result = new ArrayList<>();
    if (array == null || !array.isArray()) {
      return result;
    }
    for (JsonNode item : array) {
      if (item.isObject()) {
        result.add(wrapper.apply(((ObjectNode) item).deepCopy()));
      }
    }
    return result;
  }

  static <T> ArrayNode toArray(List<T> items, Function<T, ObjectNode> unwrapper) {
    ArrayNode array = JacksonUtility.nodes().arrayNode();
    for (T item : items) {
      array.add(unwrapper.apply(item).deepCopy());
    }
    return array;
  }
}
