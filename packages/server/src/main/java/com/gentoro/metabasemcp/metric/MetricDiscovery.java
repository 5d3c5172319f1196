package com.gentoro.metabasemcp.metric;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.query.Clauses;
import com.gentoro.metabasemcp.query.StructuredQuery;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds saved metrics defined over a table.
 *
 * <p>An empty result is a normal answer: it means no standardized metric exists yet for the table,
 * and the caller should consider defining one instead of aggregating ad hoc.
 */
public class MetricDiscovery {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(MetricDiscovery.class);

  public static final String METRIC_TYPE = "metric";
  public static final String UNKNOWN_AGGREGATION = "unknown";

  private final Gateway gateway;

  public MetricDiscovery(Gateway gateway) {
    this.gateway = gateway;
  }

  /**
   * @param tableId source table the metric must be defined on
   * @param databaseId when not null, the metric's database must match too
   */
  public List<MetricSummary> findMetrics(long tableId, Long databaseId) {
    JsonNode cards = gateway.get("/card");
    List<MetricSummary> matches = new ArrayList<>();
    for (JsonNode card : cardList(cards)) {
      if (!METRIC_TYPE.equals(card.path("type").asText())) {
        continue;
      }
      Long sourceTable = sourceTable(card);
      if (sourceTable == null || sourceTable != tableId) {
        continue;
      }
      Long database = database(card);
      if (databaseId != null && !databaseId.equals(database)) {
        continue;
      }
      matches.add(summarize(card, sourceTable, database));
    }
    log.debug("Found {} metric(s) for table {} (database {})", matches.size(), tableId, databaseId);
    return matches;
  }

  static MetricSummary summarize(JsonNode card, Long tableId, Long databaseId) {
    JsonNode query = card.path("dataset_query").path("query");
    JsonNode collection = card.path("collection");
    return new MetricSummary(
        card.path("id").asLong(),
        card.path("name").asText(null),
        textOrNull(card.get("description")),
        aggregationType(query.get(StructuredQuery.AGGREGATION)),
        hasFilter(query.get(StructuredQuery.FILTER)),
        longOrNull(card.get("collection_id")),
        collection.isObject() ? textOrNull(collection.get("name")) : null,
        tableId,
        databaseId);
  }

  /**
   * Operator tag of the first aggregation clause, looking through an {@code aggregation-options}
   * wrapper.
   */
  static String aggregationType(JsonNode aggregations) {
    if (aggregations == null || !aggregations.isArray() || aggregations.isEmpty()) {
      return UNKNOWN_AGGREGATION;
    }
    String tag = Clauses.tag(MetricWrapper.unwrap(aggregations.get(0)));
    return tag == null ? UNKNOWN_AGGREGATION : tag;
  }

  private static boolean hasFilter(JsonNode filter) {
    if (filter == null || filter.isNull()) return false;
    return !filter.isArray() || !filter.isEmpty();
  }

  // Only an absent source-table falls back to table_id; "card__N" sources never match a table.
  private static Long sourceTable(JsonNode card) {
    JsonNode fromQuery =
        card.path("dataset_query").path("query").get(StructuredQuery.SOURCE_TABLE);
    if (fromQuery == null || fromQuery.isNull()) {
      return longOrNull(card.get("table_id"));
    }
    return longOrNull(fromQuery);
  }

  private static Long database(JsonNode card) {
    Long fromQuery = longOrNull(card.path("dataset_query").get("database"));
    return fromQuery != null ? fromQuery : longOrNull(card.get("database_id"));
  }

  private static Iterable<JsonNode> cardList(JsonNode cards) {
    if (cards == null) return List.of();
    if (cards.isArray()) return cards;
    JsonNode data = cards.get("data");
    return data != null && data.isArray() ? data : List.of();
  }

  private static Long longOrNull(JsonNode node) {
    return node != null && node.isIntegralNumber() ? node.asLong() : null;
  }

  private static String textOrNull(JsonNode node) {
    return node == null || node.isNull() ? null : node.asText();
  }
}
