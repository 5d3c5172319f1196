package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Typed snapshot of a fetched dashboard. Tabs, dashcards and parameters reference each other by
 * id; every list is a detached copy of the fetched document.
 */
public record Dashboard(
    long id, List<Tab> tabs, List<Dashcard> dashcards, List<Parameter> parameters) {

  public Dashboard {
    tabs = List.copyOf(tabs);
    dashcards = List.copyOf(dashcards);
    parameters = List.copyOf(parameters);
  }

  public static Dashboard from(JsonNode document) {
    if (document == null || !document.isObject() || !document.path("id").isIntegralNumber()) {
      throw new ValidationException("Dashboard document has no numeric id");
    }
    return new Dashboard(
        document.get("id").asLong(),
        Documents.objects(document.get("tabs"), Tab::new),
        Documents.objects(document.get("dashcards"), Dashcard::new),
        Documents.objects(document.get("parameters"), Parameter::new));
  }

  public List<Long> tabIds() {
    return tabs.stream().map(Tab::id).filter(Objects::nonNull).collect(Collectors.toList());
  }

  public List<Long> dashcardIds() {
    return dashcards.stream().map(Dashcard::id).filter(Objects::nonNull).collect(Collectors.toList());
  }

  public List<String> parameterIds() {
    return parameters.stream().map(Parameter::id).filter(Objects::nonNull).collect(Collectors.toList());
  }
}
