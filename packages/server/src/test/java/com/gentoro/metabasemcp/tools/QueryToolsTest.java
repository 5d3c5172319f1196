package com.gentoro.metabasemcp.tools;

import static com.gentoro.metabasemcp.utility.JsonFixtures.assertJson;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.metabasemcp.exception.GatewayException;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.gateway.RecordingGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryToolsTest {

  private static final String STRUCTURED_ARGS =
      """
      {"database_id": 2, "source_table": 10,
       "aggregations": [["sum", ["field", 5, null]]],
       "breakouts": [["field", 7, {"temporal-unit": "month"}]],
       "filters": [["=", ["field", 3, null], "CA"], [">", ["field", 5, null], 0]],
       "order_by": [["desc", ["aggregation", 0]]],
       "limit": 12
      """;

  private RecordingGateway gateway;
  private ToolHarness tools;

  @BeforeEach
  void setUp() {
    gateway =
        new RecordingGateway()
            .respond(HttpMethod.POST, "/dataset", "{\"data\": {\"rows\": [[1], [2]]}}");
    tools = new ToolHarness(new QueryTools(gateway));
  }

  @Test
  void executeNativeQuery() throws Exception {
    tools.call(
        "execute_query",
        "{\"database_id\": 1, \"query\": \"select * from orders\","
            + " \"native_parameters\": [{\"type\": \"category\", \"value\": \"x\"}]}");

    RecordingGateway.Call call = gateway.lastCall();
    assertEquals("/dataset", call.path());
    assertJson(
        """
        {"database": 1, "type": "native",
         "native": {"query": "select * from orders",
                    "parameters": [{"type": "category", "value": "x"}]}}
        """,
        call.body());
  }

  @Test
  void runStructuredQuery() throws Exception {
    JsonNode result = tools.call("run_structured_query", STRUCTURED_ARGS + "}");

    assertEquals(2, result.path("data").path("rows").size());
    assertJson(
        """
        {"database": 2, "type": "query",
         "query": {"source-table": 10,
           "aggregation": [["sum", ["field", 5, null]]],
           "breakout": [["field", 7, {"temporal-unit": "month"}]],
           "filter": ["and", ["=", ["field", 3, null], "CA"], [">", ["field", 5, null], 0]],
           "order-by": [["desc", ["aggregation", 0]]],
           "limit": 12}}
        """,
        gateway.lastCall().body());
  }

  @Test
  void savedCardStoresTheSameQueryThatRuns() throws Exception {
    tools.call("run_structured_query", STRUCTURED_ARGS + "}");
    JsonNode ran = gateway.lastCall().body();

    tools.call(
        "create_structured_card",
        STRUCTURED_ARGS + ", \"name\": \"Monthly CA revenue\", \"collection_id\": 3}");
    JsonNode card = gateway.lastCall().body();

    assertEquals("/card", gateway.lastCall().path());
    assertEquals(ran, card.get("dataset_query"));
    assertEquals("Monthly CA revenue", card.get("name").asText());
    assertEquals("table", card.get("display").asText());
    assertEquals(2, card.get("database_id").asInt());
    assertEquals(3, card.get("collection_id").asInt());
    assertTrue(card.get("visualization_settings").isObject());
  }

  @Test
  void singleFilterIsNotWrapped() throws Exception {
    tools.call(
        "run_structured_query",
        "{\"database_id\": 2, \"source_table\": 10,"
            + " \"filter\": [\"=\", [\"field\", 3, null], \"CA\"]}");
    assertJson(
        "[\"=\", [\"field\", 3, null], \"CA\"]",
        gateway.lastCall().body().path("query").get("filter"));
  }

  @Test
  void missingSourceTableIsAValidationError() {
    assertThrows(
        ValidationException.class,
        () -> tools.call("run_structured_query", "{\"database_id\": 2}"));
    assertTrue(gateway.calls().isEmpty());
  }

  @Test
  void remoteErrorPropagates() {
    gateway.fail(HttpMethod.POST, "/dataset", 400, "{\"message\":\"bad query\"}");
    GatewayException ex =
        assertThrows(
            GatewayException.class,
            () -> tools.call("execute_query", "{\"database_id\": 1, \"query\": \"select\"}"));
    assertEquals(400, ex.getStatus());
    assertTrue(ex.getMessage().contains("bad query"));
  }
}
