package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.NotFoundException;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Plans the copy of one tab, with its dashcards and optionally the filters they use, from a source
 * dashboard onto a target dashboard.
 *
 * <p>The plan is purely additive for the target: existing tabs, dashcards and parameters are
 * written back unchanged and new entities get fresh negative ids. Planning twice against the same
 * target yields a second copy, not a no-op.
 *
 * <p>Parameter ids that collide with the target are renamed to {@code <id>_copy}, then {@code
 * <id>_copy_1}, {@code <id>_copy_2}, ... and every copied mapping follows the rename. Mappings
 * whose parameter does not exist on the target after the write are dropped.
 */
public final class TabCopier {
  static final String COPY_SUFFIX = "_copy";

  private static final List<String> CARRIED_DASHCARD_FIELDS =
      List.of("row", "col", "size_x", "size_y", "visualization_settings", "series");

  private TabCopier() {}

  /**
   * @param newTabName name of the created tab; the source tab's name when null or blank
   * @param includeFilters copy the source parameters referenced by the copied dashcards
   * @throws NotFoundException when the source has no tab {@code sourceTabId}
   */
  public static TabCopyPlan plan(
      Dashboard source,
      Dashboard target,
      long sourceTabId,
      String newTabName,
      boolean includeFilters) {
    Tab sourceTab =
        source.tabs().stream()
            .filter(tab -> Objects.equals(tab.id(), sourceTabId))
            .findFirst()
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "Tab " + sourceTabId + " not found on dashboard " + source.id(),
                        source.tabIds()));

    List<Dashcard> selected =
        source.dashcards().stream()
            .filter(dashcard -> Objects.equals(dashcard.tabId(), sourceTabId))
            .toList();

    long newTabId = IdAllocator.negativeBelow(target.tabIds()).next();
    String tabName = newTabName == null || newTabName.isBlank() ? sourceTab.name() : newTabName;
    Tab newTab = Tab.of(newTabId, tabName);

    Set<String> referenced = new LinkedHashSet<>();
    for (Dashcard dashcard : selected) {
      for (ParameterMapping mapping : dashcard.parameterMappings()) {
        if (mapping.parameterId() != null) {
          referenced.add(mapping.parameterId());
        }
      }
    }

    Set<String> targetIds = new HashSet<>(target.parameterIds());
    Map<String, String> renames = new LinkedHashMap<>();
    List<Parameter> copied = new ArrayList<>();
    if (includeFilters && !referenced.isEmpty()) {
      for (Parameter parameter : source.parameters()) {
        String id = parameter.id();
        if (id == null || !referenced.contains(id)) {
          continue;
        }
        if (targetIds.contains(id)) {
          String fresh = uniqueId(id, targetIds);
          renames.put(id, fresh);
          copied.add(parameter.withId(fresh));
          targetIds.add(fresh);
        } else {
          copied.add(parameter);
          targetIds.add(id);
        }
      }
    }

    IdAllocator dashcardIds = IdAllocator.negativeBelow(target.dashcardIds());
    List<Dashcard> newDashcards = new ArrayList<>();
    for (Dashcard dashcard : selected) {
      newDashcards.add(copyDashcard(dashcard, dashcardIds.next(), newTabId, renames, targetIds));
    }

    ObjectNode payload = JacksonUtility.nodes().objectNode();
    List<Tab> tabs = new ArrayList<>(target.tabs());
    tabs.add(newTab);
    payload.set("tabs", Documents.toArray(tabs, Tab::node));
    List<Dashcard> dashcards = new ArrayList<>(target.dashcards());
    dashcards.addAll(newDashcards);
    payload.set("dashcards", Documents.toArray(dashcards, Dashcard::node));
    if (!copied.isEmpty()) {
      List<Parameter> parameters = new ArrayList<>(target.parameters());
      parameters.addAll(copied);
      payload.set("parameters", Documents.toArray(parameters, Parameter::node));
    }

    return new TabCopyPlan(newTab, newDashcards, copied, renames, payload);
  }

  /** First of {@code id_copy, id_copy_1, id_copy_2, ...} not in {@code taken}. */
  static String uniqueId(String id, Set<String> taken) {
    String candidate = id + COPY_SUFFIX;
    int counter = 1;
    while (taken.contains(candidate)) {
      candidate = id + COPY_SUFFIX + "_" + counter++;
    }
    return candidate;
  }

  private static Dashcard copyDashcard(
      Dashcard original,
      long id,
      long tabId,
      Map<String, String> renames,
      Set<String> availableParameterIds) {
    ObjectNode node = JacksonUtility.nodes().objectNode();
    node.put("id", id);
    Long cardId = original.cardId();
    if (cardId == null) {
      node.putNull("card_id");
    } else {
      node.put("card_id", cardId);
    }
    node.put(Dashcard.TAB_ID, tabId);
    for (String field : CARRIED_DASHCARD_FIELDS) {
      JsonNode value = original.get(field);
      if (value != null) {
        node.set(field, value.deepCopy());
      }
    }

    ArrayNode mappings = node.putArray(Dashcard.PARAMETER_MAPPINGS);
    for (ParameterMapping mapping : original.parameterMappings()) {
      String parameterId = mapping.parameterId();
      String mapped = parameterId == null ? null : renames.getOrDefault(parameterId, parameterId);
      if (mapped == null || !availableParameterIds.contains(mapped)) {
        continue;
      }
      mappings.add(mapping.withParameterId(mapped).withCardId(cardId).node());
    }
    return new Dashcard(node);
  }
}
