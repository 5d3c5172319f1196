package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Placement of one card on a dashboard. Fields the view does not interpret (embedded card, series,
 * timestamps, ...) are kept as they were fetched.
 */
public record Dashcard(ObjectNode node) {
  public static final String TAB_ID = "dashboard_tab_id";
  public static final String PARAMETER_MAPPINGS = "parameter_mappings";

  public Long id() {
    return Documents.longOrNull(node.get("id"));
  }

  public Long cardId() {
    return Documents.longOrNull(node.get("card_id"));
  }

  public Long tabId() {
    return Documents.longOrNull(node.get(TAB_ID));
  }

  public List<ParameterMapping> parameterMappings() {
    return Documents.objects(node.get(PARAMETER_MAPPINGS), ParameterMapping::new);
  }

  public JsonNode get(String field) {
    return node.get(field);
  }
}
