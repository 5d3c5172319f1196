package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Dashboard filter definition ({@code id}, {@code name}, {@code slug}, {@code type} and optional
 * value-source settings). Only the id is interpreted.
 */
public record Parameter(ObjectNode node) {

  public String id() {
    return Documents.textOrNull(node.get("id"));
  }

  public String name() {
    return Documents.textOrNull(node.get("name"));
  }

  public Parameter withId(String id) {
    ObjectNode copy = node.deepCopy();
    copy.put("id", id);
    return new Parameter(copy);
  }
}
