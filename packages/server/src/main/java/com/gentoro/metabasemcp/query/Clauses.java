package com.gentoro.metabasemcp.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/**
 * Factory and accessors for structured-query clauses.
 *
 * <p>A clause is a JSON array whose first element is the operator tag, e.g. {@code ["count"]},
 * {@code ["sum", ["field", 12, null]]} or {@code ["=", ["field", 3, null], "CA"]}. Clauses are
 * passed through uninterpreted; the helpers here only build and inspect the outer shape.
 */
public final class Clauses {
  public static final String FIELD = "field";
  public static final String METRIC = "metric";

  private Clauses() {}

  /** {@code [tag, operand...]}; operands are deep-copied. */
  public static ArrayNode clause(String tag, JsonNode... operands) {
    ArrayNode node = JacksonUtility.nodes().arrayNode();
    node.add(tag);
    for (JsonNode operand : operands) {
      node.add(operand == null ? JacksonUtility.nodes().nullNode() : operand.deepCopy());
    }
    return node;
  }

  /** {@code ["field", id, null]}. */
  public static ArrayNode field(long fieldId) {
    return field(fieldId, FieldOptions.none());
  }

  /** {@code ["field", id, options]}; an empty option set is written as {@code null}. */
  public static ArrayNode field(long fieldId, FieldOptions options) {
    ArrayNode node = JacksonUtility.nodes().arrayNode();
    node.add(FIELD);
    node.add(fieldId);
    ObjectNode opts = options == null ? null : options.toJson();
    if (opts == null || opts.isEmpty()) {
      node.addNull();
    } else {
      node.add(opts);
    }
    return node;
  }

  /**
   * {@code ["metric", id]}.
   *
   * @throws ValidationException when {@code metricId} is null
   */
  public static ArrayNode metric(Long metricId) {
    if (metricId == null) {
      throw new ValidationException("Metric reference requires a metric id");
    }
    ArrayNode node = JacksonUtility.nodes().arrayNode();
    node.add(METRIC);
    node.add(metricId.longValue());
    return node;
  }

  /** Operator tag of a clause, or {@code null} when the node is not a tagged array. */
  public static String tag(JsonNode clause) {
    if (clause == null || !clause.isArray() || clause.isEmpty()) {
      return null;
    }
    JsonNode first = clause.get(0);
    return first.isTextual() ? first.asText() : null;
  }

  public static boolean hasTag(JsonNode clause, String tag) {
    return tag.equals(tag(clause));
  }
}
