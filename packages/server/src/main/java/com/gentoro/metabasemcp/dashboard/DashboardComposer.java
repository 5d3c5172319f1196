package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.NotFoundException;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-modify-write operations on a dashboard's tabs, dashcards and parameters.
 *
 * <p>Metabase has no partial update for list-valued dashboard fields: a {@code PUT
 * /dashboard/:id} replaces every list it contains. Each operation therefore fetches the current
 * representation, derives the complete new list(s) and sends them in one final write. A failure
 * before that write leaves the dashboard as it was.
 *
 * <p>Concurrent operations on the same dashboard race at that replace-the-list boundary; callers
 * that need safety must serialize calls per dashboard.
 */
public class DashboardComposer {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(DashboardComposer.class);

  /** Top-level fields accepted by {@link #updateFields}. */
  public static final Set<String> SCALAR_FIELDS =
      Set.of(
          "name",
          "description",
          "collection_id",
          "collection_position",
          "archived",
          "width",
          "auto_apply_filters",
          "cache_ttl");

  private final Gateway gateway;

  public DashboardComposer(Gateway gateway) {
    this.gateway = gateway;
  }

  public Dashboard fetch(long dashboardId) {
    return Dashboard.from(gateway.get(path(dashboardId)));
  }

  /**
   * Append one dashcard. The placement gets a fresh negative id ({@code -1} unless the dashboard
   * already holds negative ids). Existing placements of the same card are not deduplicated.
   *
   * @throws ValidationException when a parameter mapping names a filter the dashboard does not
   *     have; nothing is written
   */
  public JsonNode addDashcard(long dashboardId, DashcardPlacement placement) {
    Dashboard dashboard = fetch(dashboardId);
    long id = IdAllocator.negativeBelow(dashboard.dashcardIds()).next();
    Dashcard dashcard = placement.toDashcard(id);
    requireKnownParameters(dashcard, dashboard);

    List<Dashcard> dashcards = new ArrayList<>(dashboard.dashcards());
    dashcards.add(dashcard);

    ObjectNode payload = JacksonUtility.nodes().objectNode();
    payload.set("dashcards", Documents.toArray(dashcards, Dashcard::node));
    log.info("Adding card {} to dashboard {} as dashcard {}", placement.cardId(), dashboardId, id);
    return write(dashboardId, payload);
  }

  /**
   * Remove the dashcard {@code dashcardId}.
   *
   * @throws NotFoundException when the dashboard has no such dashcard; nothing is written
   */
  public JsonNode removeDashcard(long dashboardId, long dashcardId) {
    Dashboard dashboard = fetch(dashboardId);
    List<Dashcard> remaining = withoutDashcard(dashboard.dashcards(), dashcardId);

    ObjectNode payload = JacksonUtility.nodes().objectNode();
    payload.set("dashcards", Documents.toArray(remaining, Dashcard::node));
    log.info("Removing dashcard {} from dashboard {}", dashcardId, dashboardId);
    return write(dashboardId, payload);
  }

  /**
   * New list without {@code dashcardId}; the argument is left untouched.
   *
   * @throws NotFoundException when no element was removed
   */
  public static List<Dashcard> withoutDashcard(List<Dashcard> dashcards, long dashcardId) {
    List<Dashcard> remaining = new ArrayList<>(dashcards.size());
    for (Dashcard dashcard : dashcards) {
      if (!Objects.equals(dashcard.id(), dashcardId)) {
        remaining.add(dashcard);
      }
    }
    if (remaining.size() == dashcards.size()) {
      List<Long> available = new ArrayList<>();
      for (Dashcard dashcard : dashcards) {
        if (dashcard.id() != null) {
          available.add(dashcard.id());
        }
      }
      throw new NotFoundException("Dashcard " + dashcardId + " not found", available);
    }
    return remaining;
  }

  /**
   * Write {@code parameters} as the dashboard's complete filter list. Whatever was there before is
   * discarded; callers wanting to add filters must read and merge first.
   */
  public JsonNode replaceParameters(long dashboardId, JsonNode parameters) {
    ArrayNode list = requireArrayOfObjects(parameters, "parameters");
    ObjectNode payload = JacksonUtility.nodes().objectNode();
    payload.set("parameters", list);
    log.info("Replacing parameters of dashboard {} ({} entries)", dashboardId, list.size());
    return write(dashboardId, payload);
  }

  /**
   * Write {@code dashcards} as the dashboard's complete dashcard list (repositioning, rewiring
   * parameter mappings). Card ids are not checked.
   */
  public JsonNode replaceDashcards(long dashboardId, JsonNode dashcards) {
    ArrayNode list = requireArrayOfObjects(dashcards, "dashcards");
    ObjectNode payload = JacksonUtility.nodes().objectNode();
    payload.set("dashcards", list);
    log.info("Replacing dashcards of dashboard {} ({} entries)", dashboardId, list.size());
    return write(dashboardId, payload);
  }

  /**
   * Update scalar dashboard fields such as {@code name} or {@code description}.
   *
   * @throws ValidationException for an empty update or a field outside {@link #SCALAR_FIELDS}
   */
  public JsonNode updateFields(long dashboardId, ObjectNode fields) {
    if (fields == null || fields.isEmpty()) {
      throw new ValidationException("No dashboard fields to update");
    }
    Iterator<String> names = fields.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!SCALAR_FIELDS.contains(name)) {
        throw new ValidationException(
            "Field '" + name + "' cannot be updated here; allowed: " + SCALAR_FIELDS);
      }
    }
    log.info("Updating {} field(s) of dashboard {}", fields.size(), dashboardId);
    return write(dashboardId, fields.deepCopy());
  }

  /**
   * Copy tab {@code sourceTabId} of {@code sourceDashboardId} onto {@code targetDashboardId}. See
   * {@link TabCopier} for the id allocation and filter collision rules.
   */
  public TabCopyResult copyTab(
      long sourceDashboardId,
      long sourceTabId,
      long targetDashboardId,
      String newTabName,
      boolean includeFilters) {
    Dashboard source = fetch(sourceDashboardId);
    Dashboard target =
        sourceDashboardId == targetDashboardId ? source : fetch(targetDashboardId);

    TabCopyPlan plan = TabCopier.plan(source, target, sourceTabId, newTabName, includeFilters);
    log.info(
        "Copying tab {} of dashboard {} to dashboard {}: {} dashcard(s), {} filter(s), renames {}",
        sourceTabId,
        sourceDashboardId,
        targetDashboardId,
        plan.newDashcards().size(),
        plan.copiedParameters().size(),
        plan.parameterRenames());
    JsonNode response = write(targetDashboardId, plan.payload());
    return new TabCopyResult(plan, response);
  }

  private static void requireKnownParameters(Dashcard dashcard, Dashboard dashboard) {
    List<String> available = dashboard.parameterIds();
    Set<String> unknown = new LinkedHashSet<>();
    for (ParameterMapping mapping : dashcard.parameterMappings()) {
      String parameterId = mapping.parameterId();
      if (parameterId == null || !available.contains(parameterId)) {
        unknown.add(String.valueOf(parameterId));
      }
    }
    if (!unknown.isEmpty()) {
      throw new ValidationException(
          "Parameter mappings reference unknown dashboard parameters "
              + unknown
              + ". Available: "
              + available);
    }
  }

  private JsonNode write(long dashboardId, ObjectNode payload) {
    return gateway.send(HttpMethod.PUT, path(dashboardId), payload);
  }

  private static String path(long dashboardId) {
    return "/dashboard/" + dashboardId;
  }

  private static ArrayNode requireArrayOfObjects(JsonNode list, String name) {
    if (list == null || !list.isArray()) {
      throw new ValidationException(name + " must be an array");
    }
    for (JsonNode item : list) {
      if (!item.isObject()) {
        throw new ValidationException("Each entry of " + name + " must be an object");
      }
    }
    return (ArrayNode) list.deepCopy();
  }
}
