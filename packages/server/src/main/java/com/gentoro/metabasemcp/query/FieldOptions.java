package com.gentoro.metabasemcp.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/**
 * Options map of a field reference. Temporal unit, binning and join alias are independent and all
 * optional.
 *
 * @param temporalUnit e.g. {@code month}, {@code day-of-week}
 * @param binning e.g. {@code {"strategy": "num-bins", "num-bins": 10}}
 * @param joinAlias alias of the join the field comes from
 */
public record FieldOptions(String temporalUnit, JsonNode binning, String joinAlias) {

  public static FieldOptions none() {
    return new FieldOptions(null, null, null);
  }

  public static FieldOptions temporalUnit(String unit) {
    return new FieldOptions(unit, null, null);
  }

  public static FieldOptions joinAlias(String alias) {
    return new FieldOptions(null, null, alias);
  }

  ObjectNode toJson() {
    ObjectNode node = JacksonUtility.nodes().objectNode();
    if (temporalUnit != null) node.put("temporal-unit", temporalUnit);
    if (binning != null && !binning.isNull()) node.set("binning", binning.deepCopy());
    if (joinAlias != null) node.put("join-alias", joinAlias);
    return node;
  }
}
