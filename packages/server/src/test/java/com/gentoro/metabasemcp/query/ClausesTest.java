package com.gentoro.metabasemcp.query;

import static com.gentoro.metabasemcp.utility.JsonFixtures.assertJson;
import static com.gentoro.metabasemcp.utility.JsonFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.metabasemcp.exception.MetabaseMcpErrorCode;
import com.gentoro.metabasemcp.exception.ValidationException;
import org.junit.jupiter.api.Test;

class ClausesTest {

  @Test
  void plainFieldReference() {
    assertJson("[\"field\",12,null]", Clauses.field(12));
  }

  @Test
  void fieldWithOptions() {
    assertJson(
        "[\"field\",7,{\"temporal-unit\":\"month\"}]",
        Clauses.field(7, FieldOptions.temporalUnit("month")));
    assertJson(
        "[\"field\",7,{\"join-alias\":\"Products\"}]",
        Clauses.field(7, FieldOptions.joinAlias("Products")));
    assertJson("[\"field\",7,null]", Clauses.field(7, FieldOptions.none()));
  }

  @Test
  void metricReferenceRequiresId() {
    ValidationException ex = assertThrows(ValidationException.class, () -> Clauses.metric(null));
    assertEquals(MetabaseMcpErrorCode.VALIDATION_ERROR, ex.getCode());
    assertJson("[\"metric\",42]", Clauses.metric(42L));
  }

  @Test
  void genericClause() {
    assertJson(
        "[\"=\",[\"field\",3,null],\"CA\"]",
        Clauses.clause("=", Clauses.field(3), json("\"CA\"")));
    assertJson("[\"count\"]", Clauses.clause("count"));
  }

  @Test
  void tagInspection() {
    assertEquals("sum", Clauses.tag(json("[\"sum\",[\"field\",1,null]]")));
    assertNull(Clauses.tag(json("[]")));
    assertNull(Clauses.tag(json("{\"a\":1}")));
    assertNull(Clauses.tag(null));
    assertTrue(Clauses.hasTag(json("[\"metric\",3]"), Clauses.METRIC));
    assertFalse(Clauses.hasTag(json("[1,2]"), Clauses.METRIC));
  }
}
