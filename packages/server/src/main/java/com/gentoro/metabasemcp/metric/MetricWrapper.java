package com.gentoro.metabasemcp.metric;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.query.Clauses;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/**
 * Names aggregation clauses.
 *
 * <p>A named aggregation has the shape {@code ["aggregation-options", <aggregation>, {"name": n,
 * "display-name": n}]}. Every method returns a new tree; arguments are never mutated.
 */
public final class MetricWrapper {
  public static final String AGGREGATION_OPTIONS = "aggregation-options";

  private MetricWrapper() {}

  public static ArrayNode wrap(JsonNode aggregation, String name) {
    ArrayNode wrapped = JacksonUtility.nodes().arrayNode();
    wrapped.add(AGGREGATION_OPTIONS);
    wrapped.add(aggregation == null ? JacksonUtility.nodes().nullNode() : aggregation.deepCopy());
    wrapped.add(names(name));
    return wrapped;
  }

  /**
   * Rename a wrapped aggregation, keeping its inner clause and any other options untouched. An
   * unwrapped clause is wrapped.
   */
  public static ArrayNode rename(JsonNode clause, String newName) {
    if (!isWrapped(clause)) {
      return wrap(clause, newName);
    }
    ArrayNode renamed = (ArrayNode) clause.deepCopy();
    JsonNode existing = renamed.size() > 2 ? renamed.get(2) : null;
    ObjectNode options =
        existing != null && existing.isObject()
            ? (ObjectNode) existing
            : JacksonUtility.nodes().objectNode();
    options.put("name", newName);
    options.put("display-name", newName);
    if (renamed.size() > 2) {
      renamed.set(2, options);
    } else {
      renamed.add(options);
    }
    return renamed;
  }

  /** Inner aggregation of a wrapped clause; anything else is returned unchanged. */
  public static JsonNode unwrap(JsonNode clause) {
    if (!isWrapped(clause)) {
      return clause;
    }
    return clause.get(1);
  }

  public static boolean isWrapped(JsonNode clause) {
    return Clauses.hasTag(clause, AGGREGATION_OPTIONS) && clause.size() >= 2;
  }

  /** Display name carried by a wrapped clause, or {@code null}. */
  public static String displayName(JsonNode clause) {
    if (!isWrapped(clause) || clause.size() < 3) {
      return null;
    }
    return clause.get(2).path("display-name").asText(null);
  }

  private static ObjectNode names(String name) {
    ObjectNode options = JacksonUtility.nodes().objectNode();
    options.put("name", name);
    options.put("display-name", name);
    return options;
  }
}
