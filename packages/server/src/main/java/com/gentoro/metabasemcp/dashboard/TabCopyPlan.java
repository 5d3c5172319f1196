package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Map;

/**
 * Outcome of planning a tab copy: the entities to create and the update payload for the target.
 *
 * @param parameterRenames source parameter id to the id it received on the target, only for ids
 *     that had to change
 * @param payload body of the single {@code PUT /dashboard/:target} call
 */
public record TabCopyPlan(
    Tab newTab,
    List<Dashcard> newDashcards,
    List<Parameter> copiedParameters,
    Map<String, String> parameterRenames,
    ObjectNode payload) {

  public List<Long> newDashcardIds() {
    return newDashcards.stream().map(Dashcard::id).toList();
  }
}
