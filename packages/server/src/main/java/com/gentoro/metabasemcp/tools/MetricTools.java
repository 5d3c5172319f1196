package com.gentoro.metabasemcp.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.mcp.SchemaBuilder;
import com.gentoro.metabasemcp.mcp.ToolDefinition;
import com.gentoro.metabasemcp.mcp.ToolProvider;
import com.gentoro.metabasemcp.mcp.ToolRegistry;
import com.gentoro.metabasemcp.metric.MetricDefinition;
import com.gentoro.metabasemcp.metric.MetricDiscovery;
import com.gentoro.metabasemcp.metric.MetricService;
import com.gentoro.metabasemcp.metric.MetricSummary;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.List;

/** Metric discovery and lifecycle tools. */
public class MetricTools implements ToolProvider {
  private final MetricDiscovery discovery;
  private final MetricService metrics;

  public MetricTools(MetricDiscovery discovery, MetricService metrics) {
    this.discovery = discovery;
    this.metrics = metrics;
  }

  @Override
  public void register(ToolRegistry registry) {
    registry.register(
        new ToolDefinition(
            "find_metrics",
            "Find standardized metrics defined on a table. An empty result means no metric exists"
                + " yet; consider creating one with create_metric instead of aggregating ad hoc.",
            SchemaBuilder.object()
                .required("table_id", "integer", "The ID of the table.")
                .optional("database_id", "integer", "Restrict to metrics of this database.")
                .build(),
            args -> {
              List<MetricSummary> found =
                  discovery.findMetrics(args.requireLong("table_id"), args.optionalLong("database_id"));
              ObjectNode result = JacksonUtility.nodes().objectNode();
              result.put("count", found.size());
              result.set("metrics", JacksonUtility.getJsonMapper().valueToTree(found));
              return result;
            }));

    registry.register(
        new ToolDefinition(
            "create_metric",
            "Create a reusable metric: one named aggregation over a table, optionally filtered.",
            SchemaBuilder.object()
                .required("name", "string", "Name of the metric.")
                .required("database_id", "integer", "The ID of the database.")
                .required("table_id", "integer", "The ID of the source table.")
                .required(
                    "aggregation",
                    "array",
                    "Aggregation clause, e.g. [\"sum\", [\"field\", 12, null]].")
                .optional("filter", "array", "Optional filter clause.")
                .optional("breakouts", "array", "Optional breakout clauses.")
                .optional("description", "string", "Optional description.")
                .optional("collection_id", "integer", "Optional collection to place the metric in.")
                .build(),
            args ->
                metrics.createMetric(
                    new MetricDefinition(
                        args.requireText("name"),
                        args.requireLong("database_id"),
                        args.requireLong("table_id"),
                        args.requireNode("aggregation"),
                        args.optionalArray("filter"),
                        args.list("breakouts"),
                        args.optionalText("description"),
                        args.optionalLong("collection_id")))));

    registry.register(
        new ToolDefinition(
            "update_metric",
            "Update a metric's name, description, aggregation or filter. A new name is also"
                + " written to the aggregation's display name.",
            SchemaBuilder.object()
                .required("metric_id", "integer", "The ID of the metric.")
                .optional("name", "string", "New name.")
                .optional("description", "string", "New description.")
                .optional("aggregation", "array", "Replacement aggregation clause.")
                .optional("filter", "array", "Replacement filter clause.")
                .build(),
            args ->
                metrics.updateMetric(
                    args.optionalLong("metric_id"),
                    args.optionalText("name"),
                    args.optionalText("description"),
                    args.optionalArray("aggregation"),
                    args.optionalArray("filter"))));
  }
}
