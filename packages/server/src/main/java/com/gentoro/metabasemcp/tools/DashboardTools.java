package com.gentoro.metabasemcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.dashboard.DashboardComposer;
import com.gentoro.metabasemcp.dashboard.DashcardPlacement;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.mcp.SchemaBuilder;
import com.gentoro.metabasemcp.mcp.ToolArguments;
import com.gentoro.metabasemcp.mcp.ToolDefinition;
import com.gentoro.metabasemcp.mcp.ToolProvider;
import com.gentoro.metabasemcp.mcp.ToolRegistry;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.Iterator;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Dashboard tools. Listing, reading and creating map straight onto the API; everything that edits
 * an existing dashboard goes through {@link DashboardComposer}.
 */
public class DashboardTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(DashboardTools.class);

  private final Gateway gateway;
  private final DashboardComposer composer;

  public DashboardTools(Gateway gateway, DashboardComposer composer) {
    this.gateway = gateway;
    this.composer = composer;
  }

  @Override
  public void register(ToolRegistry registry) {
    registry.register(
        new ToolDefinition(
            "list_dashboards",
            "List all dashboards in Metabase.",
            SchemaBuilder.object().build(),
            args -> gateway.get("/dashboard")));

    registry.register(
        new ToolDefinition(
            "get_dashboard",
            "Get a dashboard with its tabs, dashcards and parameters (filters).",
            SchemaBuilder.object()
                .required("dashboard_id", "integer", "The ID of the dashboard.")
                .build(),
            args -> gateway.get("/dashboard/" + args.requireLong("dashboard_id"))));

    registry.register(
        new ToolDefinition(
            "create_dashboard",
            "Create a new, empty dashboard.",
            SchemaBuilder.object()
                .required("name", "string", "Name of the dashboard.")
                .optional("description", "string", "Optional description.")
                .optional("collection_id", "integer", "Optional collection to place it in.")
                .optional("parameters", "array", "Optional initial filter parameters.")
                .build(),
            args -> {
              String name = args.requireText("name");
              ObjectNode payload = JacksonUtility.nodes().objectNode();
              payload.put("name", name);
              String description = args.optionalText("description");
              if (StringUtils.isNotBlank(description)) {
                payload.put("description", description);
              }
              Long collectionId = args.optionalLong("collection_id");
              if (collectionId != null) {
                payload.put("collection_id", collectionId);
              }
              JsonNode parameters = args.optionalArray("parameters");
              if (parameters != null) {
                payload.set("parameters", parameters.deepCopy());
              }
              log.info("Creating dashboard '{}'", name);
              return gateway.send(HttpMethod.POST, "/dashboard", payload);
            }));

    registry.register(
        new ToolDefinition(
            "add_card_to_dashboard",
            "Place a saved card on a dashboard. Defaults to row 0, col 0 and a 4x4 size.",
            SchemaBuilder.object()
                .required("dashboard_id", "integer", "The ID of the dashboard.")
                .required("card_id", "integer", "The ID of the card to add.")
                .optional("dashboard_tab_id", "integer", "Tab to place the card on.")
                .optional("row", "integer", "Grid row.")
                .optional("col", "integer", "Grid column.")
                .optional("size_x", "integer", "Width in grid units.")
                .optional("size_y", "integer", "Height in grid units.")
                .optional(
                    "parameter_mappings", "array", "Mappings of dashboard filters to card fields.")
                .optional("visualization_settings", "object", "Per-dashcard visualization settings.")
                .build(),
            args ->
                composer.addDashcard(args.requireLong("dashboard_id"), placement(args))));

    registry.register(
        new ToolDefinition(
            "remove_card_from_dashboard",
            "Remove a dashcard (a card's placement) from a dashboard.",
            SchemaBuilder.object()
                .required("dashboard_id", "integer", "The ID of the dashboard.")
                .required("dashcard_id", "integer", "The ID of the dashcard to remove.")
                .build(),
            args ->
                composer.removeDashcard(
                    args.requireLong("dashboard_id"), args.requireLong("dashcard_id"))));

    registry.register(
        new ToolDefinition(
            "update_dashboard_parameters",
            "Replace the complete list of dashboard filters. Existing filters not in the list are"
                + " removed; read the dashboard and merge first to add a filter.",
            SchemaBuilder.object()
                .required("dashboard_id", "integer", "The ID of the dashboard.")
                .required("parameters", "array", "The new, complete list of parameters.")
                .build(),
            args ->
                composer.replaceParameters(
                    args.requireLong("dashboard_id"), args.requireNode("parameters"))));

    registry.register(
        new ToolDefinition(
            "update_dashboard_cards",
            "Replace the complete list of dashcards, e.g. to reposition cards or rewire"
                + " parameter mappings. Dashcards not in the list are removed.",
            SchemaBuilder.object()
                .required("dashboard_id", "integer", "The ID of the dashboard.")
                .required("dashcards", "array", "The new, complete list of dashcards.")
                .build(),
            args ->
                composer.replaceDashcards(
                    args.requireLong("dashboard_id"), args.requireNode("dashcards"))));

    registry.register(
        new ToolDefinition(
            "copy_dashboard_tab",
            "Copy a tab with its cards, and optionally the filters they use, to the same or"
                + " another dashboard. Colliding filter ids are renamed with a '_copy' suffix.",
            SchemaBuilder.object()
                .required("source_dashboard_id", "integer", "Dashboard holding the tab.")
                .required("source_tab_id", "integer", "The ID of the tab to copy.")
                .required("target_dashboard_id", "integer", "Dashboard receiving the copy.")
                .optional("new_tab_name", "string", "Name of the new tab; the source name by default.")
                .optional(
                    "include_filters", "boolean", "Copy the filters used by the copied cards (true).")
                .build(),
            args ->
                composer
                    .copyTab(
                        args.requireLong("source_dashboard_id"),
                        args.requireLong("source_tab_id"),
                        args.requireLong("target_dashboard_id"),
                        args.optionalText("new_tab_name"),
                        args.optionalBoolean("include_filters", true))
                    .toJson()));

    registry.register(
        new ToolDefinition(
            "update_dashboard",
            "Update dashboard fields such as name, description, collection_id or archived.",
            SchemaBuilder.object()
                .required("dashboard_id", "integer", "The ID of the dashboard.")
                .optional("name", "string", "New name.")
                .optional("description", "string", "New description.")
                .optional("collection_id", "integer", "Move to this collection.")
                .optional("collection_position", "integer", "Pin position in the collection.")
                .optional("archived", "boolean", "Archive or restore the dashboard.")
                .optional("width", "string", "'fixed' or 'full'.")
                .optional("auto_apply_filters", "boolean", "Apply filter changes immediately.")
                .optional("cache_ttl", "integer", "Cache duration.")
                .build(),
            args -> {
              return composer.updateFields(args.requireLong("dashboard_id"), updatedFields(args));
            }));
  }

  /** Supplied dashboard fields; JSON nulls count as absent, like every other argument. */
  static ObjectNode updatedFields(ToolArguments args) {
    ObjectNode fields = args.raw().deepCopy();
    fields.remove("dashboard_id");
    Iterator<Map.Entry<String, JsonNode>> entries = fields.fields();
    while (entries.hasNext()) {
      if (entries.next().getValue().isNull()) {
        entries.remove();
      }
    }
    return fields;
  }

  static DashcardPlacement placement(ToolArguments args) {
    return new DashcardPlacement(
        args.requireLong("card_id"),
        args.optionalLong("dashboard_tab_id"),
        args.optionalInt("row", 0),
        args.optionalInt("col", 0),
        args.optionalInt("size_x", DashcardPlacement.DEFAULT_SIZE_X),
        args.optionalInt("size_y", DashcardPlacement.DEFAULT_SIZE_Y),
        args.optionalArray("parameter_mappings"),
        args.optionalObject("visualization_settings"));
  }
}
