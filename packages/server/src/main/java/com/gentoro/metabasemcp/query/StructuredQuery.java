package com.gentoro.metabasemcp.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the inner {@code query} document of a structured (non-native) Metabase query.
 *
 * <p>Only the clauses that were supplied produce keys; {@code null} and empty collections are
 * treated as "not supplied" and never emitted as empty arrays or nulls. Clause contents are copied
 * as-is and not validated. Building is pure: the same inputs always give an equal document, which
 * is what lets the "run" and "save as card" paths share this builder.
 *
 * <pre>{@code
 * ObjectNode query = StructuredQuery.builder(42)
 *     .aggregations(List.of(Clauses.clause("count")))
 *     .breakouts(List.of(Clauses.field(7, FieldOptions.temporalUnit("month"))))
 *     .build();
 * // {"source-table":42,"aggregation":[["count"]],"breakout":[["field",7,{"temporal-unit":"month"}]]}
 * }</pre>
 */
public final class StructuredQuery {
  public static final String SOURCE_TABLE = "source-table";
  public static final String AGGREGATION = "aggregation";
  public static final String BREAKOUT = "breakout";
  public static final String FILTER = "filter";
  public static final String ORDER_BY = "order-by";
  public static final String EXPRESSIONS = "expressions";
  public static final String JOINS = "joins";
  public static final String FIELDS = "fields";
  public static final String LIMIT = "limit";

  private StructuredQuery() {}

  public static Builder builder(long sourceTable) {
    return new Builder(sourceTable);
  }

  /**
   * Combine filter clauses: none gives {@code null}, one is returned unchanged, several are joined
   * under {@code ["and", ...]}.
   */
  public static JsonNode combineFilters(List<? extends JsonNode> filters) {
    if (filters == null || filters.isEmpty()) {
      return null;
    }
    if (filters.size() == 1) {
      return filters.get(0);
    }
    return Clauses.clause("and", filters.toArray(new JsonNode[0]));
  }

  public static final class Builder {
    private final long sourceTable;
    private List<JsonNode> aggregations = Collections.emptyList();
    private List<JsonNode> breakouts = Collections.emptyList();
    private JsonNode filter;
    private List<JsonNode> orderBy = Collections.emptyList();
    private Map<String, JsonNode> expressions = Collections.emptyMap();
    private List<JsonNode> joins = Collections.emptyList();
    private List<JsonNode> fields = Collections.emptyList();
    private Integer limit;

    private Builder(long sourceTable) {
      this.sourceTable = sourceTable;
    }

    public Builder aggregations(List<? extends JsonNode> aggregations) {
      this.aggregations = copyOf(aggregations);
      return this;
    }

    public Builder breakouts(List<? extends JsonNode> breakouts) {
      this.breakouts = copyOf(breakouts);
      return this;
    }

    public Builder filter(JsonNode filter) {
      this.filter = filter == null || filter.isNull() ? null : filter;
      return this;
    }

    public Builder orderBy(List<? extends JsonNode> orderBy) {
      this.orderBy = copyOf(orderBy);
      return this;
    }

    public Builder expressions(Map<String, ? extends JsonNode> expressions) {
      this.expressions =
          expressions == null ? Collections.emptyMap() : new LinkedHashMap<>(expressions);
      return this;
    }

    public Builder joins(List<? extends JsonNode> joins) {
      this.joins = copyOf(joins);
      return this;
    }

    public Builder fields(List<? extends JsonNode> fields) {
      this.fields = copyOf(fields);
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    public ObjectNode build() {
      JsonNodeFactory nodes = JacksonUtility.nodes();
      ObjectNode query = nodes.objectNode();
      query.put(SOURCE_TABLE, sourceTable);
      putList(query, AGGREGATION, aggregations);
      putList(query, BREAKOUT, breakouts);
      if (filter != null) {
        query.set(FILTER, filter.deepCopy());
      }
      putList(query, ORDER_BY, orderBy);
      if (!expressions.isEmpty()) {
        ObjectNode exprs = query.putObject(EXPRESSIONS);
        expressions.forEach((name, clause) -> exprs.set(name, copy(clause)));
      }
      putList(query, JOINS, joins);
      putList(query, FIELDS, fields);
      if (limit != null) {
        query.put(LIMIT, limit.intValue());
      }
      return query;
    }

    private static void putList(ObjectNode query, String key, List<JsonNode> clauses) {
      if (clauses.isEmpty()) {
        return;
      }
      ArrayNode array = query.putArray(key);
      clauses.forEach(clause -> array.add(copy(clause)));
    }

    private static JsonNode copy(JsonNode node) {
      return node == null ? JacksonUtility.nodes().nullNode() : node.deepCopy();
    }

    private static List<JsonNode> copyOf(List<? extends JsonNode> clauses) {
      return clauses == null ? Collections.emptyList() : new ArrayList<>(clauses);
    }
  }
}
