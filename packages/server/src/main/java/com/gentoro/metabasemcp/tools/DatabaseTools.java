package com.gentoro.metabasemcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.mcp.SchemaBuilder;
import com.gentoro.metabasemcp.mcp.ToolDefinition;
import com.gentoro.metabasemcp.mcp.ToolProvider;
import com.gentoro.metabasemcp.mcp.ToolRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/** Database and table metadata tools. */
public class DatabaseTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(DatabaseTools.class);

  static final int DEFAULT_FIELD_LIMIT = 20;

  private final Gateway gateway;

  public DatabaseTools(Gateway gateway) {
    this.gateway = gateway;
  }

  @Override
  public void register(ToolRegistry registry) {
    registry.register(
        new ToolDefinition(
            "list_databases",
            "List all databases configured in Metabase.",
            SchemaBuilder.object().build(),
            args -> gateway.get("/database")));

    registry.register(
        new ToolDefinition(
            "list_tables",
            "List all tables in a database as a markdown table (id, display name, description,"
                + " entity type).",
            SchemaBuilder.object()
                .required("database_id", "integer", "The ID of the database to query.")
                .build(),
            args -> {
              long databaseId = args.requireLong("database_id");
              JsonNode metadata = gateway.get("/database/" + databaseId + "/metadata");
              return new TextNode(tablesMarkdown(databaseId, metadata.path("tables")));
            }));

    registry.register(
        new ToolDefinition(
            "get_table_fields",
            "Get the fields/columns of a table. The field list is truncated to 'limit' entries"
                + " (default 20, 0 disables truncation).",
            SchemaBuilder.object()
                .required("table_id", "integer", "The ID of the table.")
                .optional("limit", "integer", "Maximum number of fields to return.")
                .build(),
            args -> {
              long tableId = args.requireLong("table_id");
              int limit = args.optionalInt("limit", DEFAULT_FIELD_LIMIT);
              JsonNode metadata = gateway.get("/table/" + tableId + "/query_metadata");
              return truncateFields(metadata, limit);
            }));
  }

  /**
   * Keep the first {@code limit} fields and record {@code _truncated}, {@code _total_fields} and
   * {@code _limit_applied}. A non-positive limit, or a list that already fits, is left alone.
   */
  static JsonNode truncateFields(JsonNode metadata, int limit) {
    JsonNode fields = metadata.path("fields");
    if (limit <= 0 || !fields.isArray() || fields.size() <= limit) {
      log.debug("Retrieved {} fields", fields.size());
      return metadata;
    }
    ObjectNode truncated = (ObjectNode) metadata.deepCopy();
    ArrayNode kept = truncated.putArray("fields");
    for (int i = 0; i < limit; i++) {
      kept.add(fields.get(i).deepCopy());
    }
    truncated.put("_truncated", true);
    truncated.put("_total_fields", fields.size());
    truncated.put("_limit_applied", limit);
    log.debug("Truncated {} fields to {}", fields.size(), limit);
    return truncated;
  }

  static String tablesMarkdown(long databaseId, JsonNode tables) {
    List<JsonNode> rows = new ArrayList<>();
    if (tables.isArray()) {
      tables.forEach(rows::add);
    }
    rows.sort(Comparator.comparing(table -> table.path("display_name").asText("")));

    StringBuilder out = new StringBuilder();
    out.append("# Tables in Database ").append(databaseId).append("\n\n");
    out.append("**Total Tables:** ").append(rows.size()).append("\n\n");
    if (rows.isEmpty()) {
      out.append("*No tables found in this database.*\n");
      return out.toString();
    }

    out.append("| Table ID | Display Name | Description | Entity Type |\n");
    out.append("|----------|--------------|-------------|--------------|\n");
    for (JsonNode table : rows) {
      String description = table.path("description").asText("");
      out.append("| ")
          .append(table.path("id").asText("N/A"))
          .append(" | ")
          .append(escape(table.path("display_name").asText("N/A")))
          .append(" | ")
          .append(escape(StringUtils.isBlank(description) ? "No description" : description))
          .append(" | ")
          .append(StringUtils.defaultIfBlank(table.path("entity_type").asText(""), "N/A"))
          .append(" |\n");
    }
    return out.toString();
  }

  private static String escape(String cell) {
    return StringUtils.replace(cell, "|", "\\|");
  }
}
