package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/** Dashboard tab. */
public record Tab(ObjectNode node) {

  public static Tab of(long id, String name) {
    ObjectNode node = JacksonUtility.nodes().objectNode();
    node.put("id", id);
    node.put("name", name);
    return new Tab(node);
  }

  public Long id() {
    return Documents.longOrNull(node.get("id"));
  }

  public String name() {
    return Documents.textOrNull(node.get("name"));
  }
}
