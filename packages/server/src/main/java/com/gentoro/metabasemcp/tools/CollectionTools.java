package com.gentoro.metabasemcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.mcp.SchemaBuilder;
import com.gentoro.metabasemcp.mcp.ToolDefinition;
import com.gentoro.metabasemcp.mcp.ToolProvider;
import com.gentoro.metabasemcp.mcp.ToolRegistry;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import org.apache.commons.lang3.StringUtils;

public class CollectionTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(CollectionTools.class);

  private final Gateway gateway;

  public CollectionTools(Gateway gateway) {
    this.gateway = gateway;
  }

  @Override
  public void register(ToolRegistry registry) {
    registry.register(
        new ToolDefinition(
            "list_collections",
            "List all collections in Metabase.",
            SchemaBuilder.object().build(),
            args -> gateway.get("/collection")));

    registry.register(
        new ToolDefinition(
            "create_collection",
            "Create a new collection in Metabase.",
            SchemaBuilder.object()
                .required("name", "string", "Name of the collection.")
                .optional("description", "string", "Optional description.")
                .optional("color", "string", "Optional color for the collection.")
                .optional("parent_id", "integer", "Optional parent collection ID.")
                .build(),
            args -> {
              String name = args.requireText("name");
              ObjectNode payload = JacksonUtility.nodes().objectNode();
              payload.put("name", name);
              String description = args.optionalText("description");
              if (StringUtils.isNotBlank(description)) {
                payload.put("description", description);
              }
              String color = args.optionalText("color");
              if (StringUtils.isNotBlank(color)) {
                payload.put("color", color);
              }
              Long parentId = args.optionalLong("parent_id");
              if (parentId != null) {
                payload.put("parent_id", parentId);
              }
              log.info("Creating collection '{}'", name);
              JsonNode created = gateway.send(HttpMethod.POST, "/collection", payload);
              log.info("Created collection {}", created.path("id"));
              return created;
            }));
  }
}
