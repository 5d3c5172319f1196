package com.gentoro.metabasemcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.mcp.SchemaBuilder;
import com.gentoro.metabasemcp.mcp.ToolArguments;
import com.gentoro.metabasemcp.mcp.ToolDefinition;
import com.gentoro.metabasemcp.mcp.ToolProvider;
import com.gentoro.metabasemcp.mcp.ToolRegistry;
import com.gentoro.metabasemcp.query.DatasetQuery;
import com.gentoro.metabasemcp.query.StructuredQuery;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Query execution tools. {@code run_structured_query} and {@code create_structured_card} share
 * {@link #datasetQuery(ToolArguments)}, so the same arguments run and save the same document.
 */
public class QueryTools implements ToolProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(QueryTools.class);

  static final String DEFAULT_DISPLAY = "table";

  private final Gateway gateway;

  public QueryTools(Gateway gateway) {
    this.gateway = gateway;
  }

  @Override
  public void register(ToolRegistry registry) {
    registry.register(
        new ToolDefinition(
            "execute_query",
            "Execute a native SQL query against a Metabase database.",
            SchemaBuilder.object()
                .required("database_id", "integer", "The ID of the database to query.")
                .required("query", "string", "The SQL query to execute.")
                .optional("native_parameters", "array", "Optional parameters for the query.")
                .build(),
            args -> {
              long databaseId = args.requireLong("database_id");
              String sql = args.requireText("query");
              ObjectNode payload =
                  DatasetQuery.nativeQuery(databaseId, sql, args.optionalArray("native_parameters"));
              log.info("Executing native query on database {}", databaseId);
              JsonNode result = gateway.send(HttpMethod.POST, "/dataset", payload);
              logRows(result);
              return result;
            }));

    registry.register(
        new ToolDefinition(
            "run_structured_query",
            "Run a structured (MBQL) query built from aggregation, breakout, filter, order-by,"
                + " expression, join and field clauses.",
            structuredSchema().build(),
            args -> {
              ObjectNode payload = datasetQuery(args);
              log.info("Running structured query on database {}", payload.path("database"));
              JsonNode result = gateway.send(HttpMethod.POST, "/dataset", payload);
              logRows(result);
              return result;
            }));

    registry.register(
        new ToolDefinition(
            "create_structured_card",
            "Save a structured (MBQL) query as a new card/question.",
            structuredSchema()
                .required("name", "string", "Name of the card.")
                .optional("description", "string", "Optional description.")
                .optional("collection_id", "integer", "Optional collection to place the card in.")
                .optional("display", "string", "Visualization type, 'table' by default.")
                .optional(
                    "visualization_settings", "object", "Optional visualization configuration.")
                .build(),
            args -> {
              ObjectNode card = JacksonUtility.nodes().objectNode();
              card.put("name", args.requireText("name"));
              ObjectNode datasetQuery = datasetQuery(args);
              card.put("database_id", datasetQuery.path("database").asLong());
              card.set("dataset_query", datasetQuery);
              String display = args.optionalText("display");
              card.put("display", display == null || display.isBlank() ? DEFAULT_DISPLAY : display);
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
              JsonNode created = gateway.send(HttpMethod.POST, "/card", card);
              log.info("Created structured card {}", created.path("id"));
              return created;
            }));
  }

  /**
   * Builds the {@code {database, type:"query", query}} document from the structured query
   * arguments. {@code filters} holds one or more filter clauses; several are combined with {@code
   * and}.
   */
  static ObjectNode datasetQuery(ToolArguments args) {
    long databaseId = args.requireLong("database_id");
    long sourceTable = args.requireLong("source_table");

    List<JsonNode> filters = new ArrayList<>(args.list("filters"));
    JsonNode filter = args.node("filter");
    if (filter != null) {
      if (!filter.isArray()) {
        throw new ValidationException("Argument 'filter' must be a clause array");
      }
      filters.add(0, filter);
    }

    ObjectNode query =
        StructuredQuery.builder(sourceTable)
            .aggregations(args.list("aggregations"))
            .breakouts(args.list("breakouts"))
            .filter(StructuredQuery.combineFilters(filters))
            .orderBy(args.list("order_by"))
            .expressions(args.map("expressions"))
            .joins(args.list("joins"))
            .fields(args.list("fields"))
            .limit(args.optionalInt("limit"))
            .build();
    return DatasetQuery.structured(databaseId, query);
  }

  private static SchemaBuilder structuredSchema() {
    return SchemaBuilder.object()
        .required("database_id", "integer", "The ID of the database.")
        .required("source_table", "integer", "The ID of the table to query.")
        .optional(
            "aggregations",
            "array",
            "Aggregation clauses, e.g. [\"count\"], [\"sum\", [\"field\", 12, null]] or"
                + " [\"metric\", 42].")
        .optional("breakouts", "array", "Breakout (group by) clauses.")
        .optional("filter", "array", "A single filter clause.")
        .optional("filters", "array", "Filter clauses, combined with 'and'.")
        .optional("order_by", "array", "Order-by clauses, e.g. [\"desc\", [\"aggregation\", 0]].")
        .optional("expressions", "object", "Named custom expressions.")
        .optional("joins", "array", "Join clauses.")
        .optional("fields", "array", "Fields to return.")
        .optional("limit", "integer", "Maximum number of rows.");
  }

  private static void logRows(JsonNode result) {
    log.info("Query returned {} rows", result.path("data").path("rows").size());
  }
}
