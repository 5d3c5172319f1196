package com.gentoro.metabasemcp.metric;

import static com.gentoro.metabasemcp.utility.JsonFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.metabasemcp.exception.GatewayException;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.gateway.RecordingGateway;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricDiscoveryTest {

  private static final String CARDS =
      """
      [
        {"id": 1, "name": "Revenue", "type": "metric", "description": "Total revenue",
         "collection_id": 4, "collection": {"id": 4, "name": "Finance"},
         "dataset_query": {"database": 2, "type": "query",
           "query": {"source-table": 10,
             "aggregation": [["aggregation-options", ["sum", ["field", 5, null]],
                              {"name": "Revenue", "display-name": "Revenue"}]]}}},
        {"id": 2, "name": "Orders in CA", "type": "metric", "description": null,
         "dataset_query": {"database": 2, "type": "query",
           "query": {"source-table": 10, "aggregation": [["count"]],
             "filter": ["=", ["field", 7, null], "CA"]}}},
        {"id": 3, "name": "Revenue question", "type": "question",
         "dataset_query": {"database": 2, "type": "query",
           "query": {"source-table": 10, "aggregation": [["sum", ["field", 5, null]]]}}},
        {"id": 4, "name": "Other table", "type": "metric",
         "dataset_query": {"database": 2, "type": "query",
           "query": {"source-table": 11, "aggregation": [["count"]]}}},
        {"id": 5, "name": "Other database", "type": "metric",
         "dataset_query": {"database": 3, "type": "query",
           "query": {"source-table": 10, "aggregation": [["count"]]}}},
        {"id": 6, "name": "Legacy", "type": "metric", "table_id": 10, "database_id": 2,
         "dataset_query": {"database": 2, "type": "query", "query": {}}}
      ]
      """;

  @Test
  void findsMetricsOfTable() {
    RecordingGateway gateway = new RecordingGateway().respond(HttpMethod.GET, "/card", CARDS);

    List<MetricSummary> metrics = new MetricDiscovery(gateway).findMetrics(10, null);

    assertEquals(List.of(1L, 2L, 5L, 6L), metrics.stream().map(MetricSummary::id).toList());

    MetricSummary revenue = metrics.get(0);
    assertEquals("Revenue", revenue.name());
    assertEquals("Total revenue", revenue.description());
    assertEquals("sum", revenue.aggregationType());
    assertFalse(revenue.hasFilter());
    assertEquals(4L, revenue.collectionId());
    assertEquals("Finance", revenue.collectionName());
    assertEquals(10L, revenue.tableId());
    assertEquals(2L, revenue.databaseId());

    MetricSummary orders = metrics.get(1);
    assertEquals("count", orders.aggregationType());
    assertTrue(orders.hasFilter());
    assertNull(orders.description());
    assertNull(orders.collectionId());
  }

  @Test
  void databaseFilterNarrowsResults() {
    RecordingGateway gateway = new RecordingGateway().respond(HttpMethod.GET, "/card", CARDS);

    List<MetricSummary> metrics = new MetricDiscovery(gateway).findMetrics(10, 3L);

    assertEquals(1, metrics.size());
    assertEquals(5L, metrics.get(0).id());
  }

  @Test
  void missingAggregationIsUnknown() {
    RecordingGateway gateway = new RecordingGateway().respond(HttpMethod.GET, "/card", CARDS);

    MetricSummary legacy = new MetricDiscovery(gateway).findMetrics(10, 2L).stream()
        .filter(metric -> metric.id() == 6L)
        .findFirst()
        .orElseThrow();

    assertEquals(MetricDiscovery.UNKNOWN_AGGREGATION, legacy.aggregationType());
    assertEquals(10L, legacy.tableId());
  }

  @Test
  void noMatchIsAnEmptyList() {
    RecordingGateway gateway = new RecordingGateway().respond(HttpMethod.GET, "/card", CARDS);
    assertTrue(new MetricDiscovery(gateway).findMetrics(99, null).isEmpty());
  }

  @Test
  void acceptsWrappedCardList() {
    RecordingGateway gateway =
        new RecordingGateway()
            .respond(HttpMethod.GET, "/card", "{\"data\": " + CARDS + ", \"total\": 6}");
    assertEquals(4, new MetricDiscovery(gateway).findMetrics(10, null).size());
  }

  @Test
  void aggregationTypeOfMalformedClauses() {
    assertEquals("unknown", MetricDiscovery.aggregationType(null));
    assertEquals("unknown", MetricDiscovery.aggregationType(json("[]")));
    assertEquals("unknown", MetricDiscovery.aggregationType(json("[[]]")));
    assertEquals("unknown", MetricDiscovery.aggregationType(json("[[42]]")));
    assertEquals("count", MetricDiscovery.aggregationType(json("[[\"count\"],[\"sum\"]]")));
  }

  @Test
  void metricsOnModelsDoNotMatchTheUnderlyingTable() {
    RecordingGateway gateway =
        new RecordingGateway()
            .respond(
                HttpMethod.GET,
                "/card",
                """
                [{"id": 7, "name": "Model metric", "type": "metric", "table_id": 10,
                  "database_id": 2,
                  "dataset_query": {"database": 2, "type": "query",
                    "query": {"source-table": "card__12", "aggregation": [["count"]]}}}]
                """);

    assertTrue(new MetricDiscovery(gateway).findMetrics(10, null).isEmpty());
  }

  @Test
  void remoteFailurePropagates() {
    RecordingGateway gateway = new RecordingGateway().fail(HttpMethod.GET, "/card", 500, "boom");
    GatewayException ex =
        assertThrows(GatewayException.class, () -> new MetricDiscovery(gateway).findMetrics(1, null));
    assertEquals(500, ex.getStatus());
  }
}
