package com.gentoro.metabasemcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.mcp.SchemaBuilder;
import com.gentoro.metabasemcp.mcp.ToolDefinition;
import com.gentoro.metabasemcp.mcp.ToolProvider;
import com.gentoro.metabasemcp.mcp.ToolRegistry;
import com.gentoro.metabasemcp.query.DatasetQuery;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/** Saved question (card) tools. */
public class CardTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(CardTools.class);

  private final Gateway gateway;

  public CardTools(Gateway gateway) {
    this.gateway = gateway;
  }

  @Override
  public void register(ToolRegistry registry) {
    registry.register(
        new ToolDefinition(
            "list_cards",
            "List all saved questions/cards in Metabase.",
            SchemaBuilder.object().build(),
            args -> gateway.get("/card")));

    registry.register(
        new ToolDefinition(
            "execute_card",
            "Execute a saved Metabase question/card and retrieve results.",
            SchemaBuilder.object()
                .required("card_id", "integer", "The ID of the card to execute.")
                .optional("parameters", "array", "Optional parameters for the card execution.")
                .build(),
            args -> {
              long cardId = args.requireLong("card_id");
              ObjectNode payload = JacksonUtility.nodes().objectNode();
              JsonNode parameters = args.node("parameters");
              if (parameters != null && parameters.size() > 0) {
                payload.set("parameters", parameters.deepCopy());
              }
              log.info("Executing card {}", cardId);
              return gateway.send(HttpMethod.POST, "/card/" + cardId + "/query", payload);
            }));

    registry.register(
        new ToolDefinition(
            "create_card",
            "Create a new question/card from a native SQL query.",
            SchemaBuilder.object()
                .required("name", "string", "Name of the card.")
                .required("database_id", "integer", "ID of the database to query.")
                .required("query", "string", "SQL query for the card.")
                .optional("description", "string", "Optional description.")
                .optional("collection_id", "integer", "Optional collection to place the card in.")
                .optional(
                    "visualization_settings", "object", "Optional visualization configuration.")
                .build(),
            args -> {
              String name = args.requireText("name");
              long databaseId = args.requireLong("database_id");
              ObjectNode card = JacksonUtility.nodes().objectNode();
              card.put("name", name);
              card.put("database_id", databaseId);
              card.set(
                  "dataset_query",
                  DatasetQuery.nativeQuery(databaseId, args.requireText("query"), null));
              card.put("display", QueryTools.DEFAULT_DISPLAY);
              ObjectNode settings = args.optionalObject("visualization_settings");
              card.set(
                  "visualization_settings",
                  settings == null ? JacksonUtility.nodes().objectNode() : settings.deepCopy());
              String description = args.optionalText("description");
              if (description != null && !description.isBlank()) {
                card.put("description", description);
              }
              Long collectionId = args.optionalLong("collection_id");
              if (collectionId != null) {
                card.put("collection_id", collectionId);
              }
              log.info("Creating card '{}' in database {}", name, databaseId);
              JsonNode created = gateway.send(HttpMethod.POST, "/card", card);
              log.info("Created card {}", created.path("id"));
              return created;
            }));
  }
}
