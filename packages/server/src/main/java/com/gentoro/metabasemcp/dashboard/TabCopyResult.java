package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/** A written tab copy: what was planned plus the target dashboard as returned by Metabase. */
public record TabCopyResult(TabCopyPlan plan, JsonNode response) {

  /** Summary reported back to tool callers. */
  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.nodes().objectNode();
    node.put("new_tab_id", plan.newTab().id());
    node.put("new_tab_name", plan.newTab().name());
    node.set("new_dashcard_ids", JacksonUtility.getJsonMapper().valueToTree(plan.newDashcardIds()));
    node.set(
        "copied_parameter_ids",
        JacksonUtility.getJsonMapper()
            .valueToTree(plan.copiedParameters().stream().map(Parameter::id).toList()));
    node.set("parameter_renames", JacksonUtility.getJsonMapper().valueToTree(plan.parameterRenames()));
    node.set("dashboard", response);
    return node;
  }
}
