package com.gentoro.metabasemcp.query;

import static com.gentoro.metabasemcp.utility.JsonFixtures.array;
import static com.gentoro.metabasemcp.utility.JsonFixtures.assertJson;
import static com.gentoro.metabasemcp.utility.JsonFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StructuredQueryTest {

  private static final String[] OPTIONAL_KEYS = {
    StructuredQuery.AGGREGATION,
    StructuredQuery.BREAKOUT,
    StructuredQuery.FILTER,
    StructuredQuery.ORDER_BY,
    StructuredQuery.EXPRESSIONS,
    StructuredQuery.JOINS,
    StructuredQuery.FIELDS
  };

  @Test
  void sourceTableOnly() {
    ObjectNode query = StructuredQuery.builder(42).build();
    assertJson("{\"source-table\":42}", query);
  }

  @Test
  void monthlyRevenueBreakout() {
    ObjectNode query =
        StructuredQuery.builder(5)
            .aggregations(List.of(Clauses.clause("sum", Clauses.field(12))))
            .breakouts(List.of(Clauses.field(7, FieldOptions.temporalUnit("month"))))
            .build();

    assertJson(
            """
            {"source-table":5,
             "aggregation":[["sum",["field",12,null]]],
             "breakout":[["field",7,{"temporal-unit":"month"}]]}
            """,
        query);
  }

  @Test
  void onlySuppliedClausesProduceKeys() {
    // every subset of the optional clauses
    for (int mask = 0; mask < (1 << OPTIONAL_KEYS.length); mask++) {
      StructuredQuery.Builder builder = StructuredQuery.builder(1);
      if ((mask & 1) != 0) builder.aggregations(List.of(array("[\"count\"]")));
      if ((mask & 2) != 0) builder.breakouts(List.of(Clauses.field(2)));
      if ((mask & 4) != 0) builder.filter(array("[\"=\",[\"field\",3,null],\"CA\"]"));
      if ((mask & 8) != 0) builder.orderBy(List.of(array("[\"desc\",[\"aggregation\",0]]")));
      if ((mask & 16) != 0) {
        builder.expressions(Map.of("double", array("[\"*\",2,[\"field\",4,null]]")));
      }
      if ((mask & 32) != 0) builder.joins(List.of(json("{\"source-table\":9,\"alias\":\"P\"}")));
      if ((mask & 64) != 0) builder.fields(List.of(Clauses.field(5)));

      ObjectNode query = builder.build();
      List<String> expected = new ArrayList<>();
      expected.add(StructuredQuery.SOURCE_TABLE);
      for (int bit = 0; bit < OPTIONAL_KEYS.length; bit++) {
        if ((mask & (1 << bit)) != 0) {
          expected.add(OPTIONAL_KEYS[bit]);
        }
      }
      assertEquals(expected, keys(query), "mask " + mask);
    }
  }

  @Test
  void nullAndEmptyInputsAreOmitted() {
    ObjectNode query =
        StructuredQuery.builder(3)
            .aggregations(List.of())
            .breakouts(null)
            .filter(null)
            .orderBy(List.of())
            .expressions(Map.of())
            .joins(null)
            .fields(List.of())
            .limit(null)
            .build();
    assertEquals(List.of(StructuredQuery.SOURCE_TABLE), keys(query));
  }

  @Test
  void limitIsWrittenAsNumber() {
    ObjectNode query = StructuredQuery.builder(3).limit(10).build();
    assertEquals(10, query.get(StructuredQuery.LIMIT).asInt());
  }

  @Test
  void equalInputsGiveEqualDocuments() {
    ArrayNode count = array("[\"count\"]");
    ObjectNode first =
        StructuredQuery.builder(8).aggregations(List.of(count)).limit(5).build();
    ObjectNode second =
        StructuredQuery.builder(8).aggregations(List.of(count)).limit(5).build();
    assertEquals(first, second);
    assertEquals(first.toString(), second.toString());
  }

  @Test
  void clausesAreCopiedNotShared() {
    ArrayNode filter = array("[\"=\",[\"field\",3,null],\"CA\"]");
    ObjectNode query = StructuredQuery.builder(1).filter(filter).build();
    filter.add("mutated");
    assertEquals(3, query.get(StructuredQuery.FILTER).size());
  }

  @Test
  void metricReferenceAsAggregation() {
    ObjectNode query =
        StructuredQuery.builder(4).aggregations(List.of(Clauses.metric(17L))).build();
    assertJson("[[\"metric\",17]]", query.get(StructuredQuery.AGGREGATION));
  }

  @Test
  void combineFilters() {
    JsonNode a = array("[\"=\",[\"field\",1,null],\"a\"]");
    JsonNode b = array("[\">\",[\"field\",2,null],3]");

    assertNull(StructuredQuery.combineFilters(List.of()));
    assertNull(StructuredQuery.combineFilters(null));
    assertEquals(a, StructuredQuery.combineFilters(List.of(a)));
    JsonNode combined = StructuredQuery.combineFilters(List.of(a, b));
    assertEquals("and", combined.get(0).asText());
    assertEquals(a, combined.get(1));
    assertEquals(b, combined.get(2));
  }

  @Test
  void datasetQueryEnvelope() {
    ObjectNode inner = StructuredQuery.builder(4).build();
    ObjectNode dataset = DatasetQuery.structured(2, inner);
    assertJson(
        "{\"database\":2,\"type\":\"query\",\"query\":{\"source-table\":4}}", dataset);
  }

  @Test
  void nativeQueryOmitsEmptyParameters() {
    ObjectNode withoutParams = DatasetQuery.nativeQuery(1, "select 1", array("[]"));
    assertFalse(withoutParams.path("native").has("parameters"));

    ObjectNode withParams =
        DatasetQuery.nativeQuery(1, "select 1", array("[{\"type\":\"category\",\"value\":\"x\"}]"));
    assertEquals(1, withParams.path("native").path("parameters").size());
    assertEquals("native", withParams.path("type").asText());
  }

  private static List<String> keys(ObjectNode node) {
    List<String> keys = new ArrayList<>();
    Iterator<String> names = node.fieldNames();
    names.forEachRemaining(keys::add);
    return keys;
  }
}
