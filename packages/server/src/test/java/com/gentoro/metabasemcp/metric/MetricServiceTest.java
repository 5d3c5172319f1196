package com.gentoro.metabasemcp.metric;

import static com.gentoro.metabasemcp.utility.JsonFixtures.array;
import static com.gentoro.metabasemcp.utility.JsonFixtures.assertJson;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.gateway.RecordingGateway;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricServiceTest {

  private static final String STORED_METRIC =
      """
      {"id": 7, "name": "Revenue", "type": "metric", "display": "scalar",
       "dataset_query": {"database": 2, "type": "query",
         "query": {"source-table": 10,
           "aggregation": [["aggregation-options", ["sum", ["field", 5, null]],
                            {"name": "Revenue", "display-name": "Revenue"}]],
           "filter": ["=", ["field", 7, null], "CA"]}}}
      """;

  @Test
  void createMetricPostsWrappedAggregation() {
    RecordingGateway gateway = new RecordingGateway();
    MetricService service = new MetricService(gateway);

    service.createMetric(
        new MetricDefinition(
            "Revenue",
            2,
            10,
            array("[\"sum\",[\"field\",5,null]]"),
            array("[\">\",[\"field\",6,null],0]"),
            List.of(),
            "Total revenue",
            4L));

    RecordingGateway.Call call = gateway.lastCall();
    assertEquals(HttpMethod.POST, call.method());
    assertEquals("/card", call.path());
    assertJson(
        """
        {"name": "Revenue", "type": "metric", "display": "scalar", "database_id": 2,
         "dataset_query": {"database": 2, "type": "query",
           "query": {"source-table": 10,
             "aggregation": [["aggregation-options", ["sum", ["field", 5, null]],
                              {"name": "Revenue", "display-name": "Revenue"}]],
             "filter": [">", ["field", 6, null], 0]}},
         "visualization_settings": {},
         "description": "Total revenue",
         "collection_id": 4}
        """,
        call.body());
  }

  @Test
  void createMetricRequiresNameAndAggregation() {
    MetricService service = new MetricService(new RecordingGateway());
    assertThrows(
        ValidationException.class,
        () ->
            service.createMetric(
                new MetricDefinition(" ", 1, 1, array("[\"count\"]"), null, null, null, null)));
    assertThrows(
        ValidationException.class,
        () ->
            service.createMetric(new MetricDefinition("Count", 1, 1, null, null, null, null, null)));
  }

  @Test
  void renameUpdatesCardAndAnnotation() {
    RecordingGateway gateway =
        new RecordingGateway().respond(HttpMethod.GET, "/card/7", STORED_METRIC);

    new MetricService(gateway).updateMetric(7L, "Gross Revenue", null, null, null);

    RecordingGateway.Call put = gateway.lastCall();
    assertEquals(HttpMethod.PUT, put.method());
    assertEquals("/card/7", put.path());
    assertEquals("Gross Revenue", put.body().get("name").asText());
    JsonNode query = put.body().path("dataset_query").path("query");
    assertJson(
        "[[\"aggregation-options\",[\"sum\",[\"field\",5,null]],"
            + "{\"name\":\"Gross Revenue\",\"display-name\":\"Gross Revenue\"}]]",
        query.get("aggregation"));
    assertJson("[\"=\",[\"field\",7,null],\"CA\"]", query.get("filter"));
  }

  @Test
  void newAggregationIsWrappedWithCurrentName() {
    RecordingGateway gateway =
        new RecordingGateway().respond(HttpMethod.GET, "/card/7", STORED_METRIC);

    new MetricService(gateway)
        .updateMetric(7L, null, null, array("[\"avg\",[\"field\",5,null]]"), null);

    JsonNode body = gateway.lastCall().body();
    assertFalse(body.has("name"));
    assertJson(
        "[[\"aggregation-options\",[\"avg\",[\"field\",5,null]],"
            + "{\"name\":\"Revenue\",\"display-name\":\"Revenue\"}]]",
        body.path("dataset_query").path("query").get("aggregation"));
  }

  @Test
  void descriptionOnlyLeavesQueryAlone() {
    RecordingGateway gateway =
        new RecordingGateway().respond(HttpMethod.GET, "/card/7", STORED_METRIC);

    new MetricService(gateway).updateMetric(7L, null, "Net of refunds", null, null);

    assertJson("{\"description\":\"Net of refunds\"}", gateway.lastCall().body());
  }

  @Test
  void missingIdFailsWithoutRemoteCall() {
    RecordingGateway gateway = new RecordingGateway();
    assertThrows(
        ValidationException.class,
        () -> new MetricService(gateway).updateMetric(null, "x", null, null, null));
    assertTrue(gateway.calls().isEmpty());
  }

  @Test
  void emptyUpdateIsRejected() {
    RecordingGateway gateway =
        new RecordingGateway().respond(HttpMethod.GET, "/card/7", STORED_METRIC);
    assertThrows(
        ValidationException.class,
        () -> new MetricService(gateway).updateMetric(7L, null, null, null, null));
    assertTrue(gateway.calls(HttpMethod.PUT).isEmpty());
  }
}
