package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.node.ObjectNode;

/** Binds a dashboard parameter to a card-side target ({@code parameter_id, card_id, target}). */
public record ParameterMapping(ObjectNode node) {

  public String parameterId() {
    return Documents.textOrNull(node.get("parameter_id"));
  }

  public Long cardId() {
    return Documents.longOrNull(node.get("card_id"));
  }

  public ParameterMapping withParameterId(String parameterId) {
    ObjectNode copy = node.deepCopy();
    copy.put("parameter_id", parameterId);
    return new ParameterMapping(copy);
  }

  public ParameterMapping withCardId(Long cardId) {
    ObjectNode copy = node.deepCopy();
    if (cardId == null) {
      copy.putNull("card_id");
    } else {
      copy.put("card_id", cardId);
    }
    return new ParameterMapping(copy);
  }
}
