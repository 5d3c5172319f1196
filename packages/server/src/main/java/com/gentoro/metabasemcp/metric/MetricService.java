package com.gentoro.metabasemcp.metric;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.gateway.Gateway;
import com.gentoro.metabasemcp.gateway.HttpMethod;
import com.gentoro.metabasemcp.query.DatasetQuery;
import com.gentoro.metabasemcp.query.StructuredQuery;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.List;

/**
 * Creates and updates metrics, i.e. saved cards of type {@code metric} whose structured query holds
 * exactly one named aggregation.
 */
public class MetricService {
  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(MetricService.class);

  private final Gateway gateway;

  public MetricService(Gateway gateway) {
    this.gateway = gateway;
  }

  public JsonNode createMetric(MetricDefinition definition) {
    if (definition.name() == null || definition.name().isBlank()) {
      throw new ValidationException("Metric name is required");
    }
    if (definition.aggregation() == null || definition.aggregation().isNull()) {
      throw new ValidationException("Metric aggregation is required");
    }

    ObjectNode query =
        StructuredQuery.builder(definition.tableId())
            .aggregations(List.of(MetricWrapper.wrap(definition.aggregation(), definition.name())))
            .breakouts(definition.breakouts())
            .filter(definition.filter())
            .build();

    ObjectNode payload = JacksonUtility.nodes().objectNode();
    payload.put("name", definition.name());
    payload.put("type", MetricDiscovery.METRIC_TYPE);
    payload.put("display", "scalar");
    payload.put("database_id", definition.databaseId());
    payload.set("dataset_query", DatasetQuery.structured(definition.databaseId(), query));
    payload.putObject("visualization_settings");
    if (definition.description() != null) {
      payload.put("description", definition.description());
    }
    if (definition.collectionId() != null) {
      payload.put("collection_id", definition.collectionId());
    }

    JsonNode created = gateway.send(HttpMethod.POST, "/card", payload);
    log.info("Created metric '{}' with id {}", definition.name(), created.path("id").asText());
    return created;
  }

  /**
   * Update a metric. A new name is written both to the card and to the aggregation's
   * name/display-name annotation; a new aggregation replaces the stored one and is wrapped with the
   * current (or new) name.
   *
   * @param newAggregation replacement aggregation clause, or null to keep the stored one
   * @param newFilter replacement filter clause, or null to keep the stored one
   */
  public JsonNode updateMetric(
      Long metricId,
      String newName,
      String newDescription,
      JsonNode newAggregation,
      JsonNode newFilter) {
    if (metricId == null) {
      throw new ValidationException("Metric id is required");
    }
    JsonNode card = gateway.get("/card/" + metricId);
    String name = newName != null ? newName : card.path("name").asText(null);

    ObjectNode payload = JacksonUtility.nodes().objectNode();
    if (newName != null) {
      payload.put("name", newName);
    }
    if (newDescription != null) {
      payload.put("description", newDescription);
    }

    if (newName != null || newAggregation != null || newFilter != null) {
      JsonNode datasetQuery = card.get("dataset_query");
      if (datasetQuery == null || !datasetQuery.path("query").isObject()) {
        throw new ValidationException(
            "Metric " + metricId + " has no structured query to update");
      }
      payload.set("dataset_query", rewrite(datasetQuery, name, newAggregation, newFilter));
    }

    if (payload.isEmpty()) {
      throw new ValidationException("Nothing to update for metric " + metricId);
    }
    JsonNode updated = gateway.send(HttpMethod.PUT, "/card/" + metricId, payload);
    log.info("Updated metric {}", metricId);
    return updated;
  }

  static ObjectNode rewrite(
      JsonNode datasetQuery, String name, JsonNode newAggregation, JsonNode newFilter) {
    ObjectNode rewritten = (ObjectNode) datasetQuery.deepCopy();
    ObjectNode query = (ObjectNode) rewritten.get("query");

    JsonNode aggregations = query.get(StructuredQuery.AGGREGATION);
    JsonNode current =
        aggregations != null && aggregations.isArray() && !aggregations.isEmpty()
            ? aggregations.get(0)
            : null;
    JsonNode aggregation;
    if (newAggregation != null) {
      aggregation = MetricWrapper.wrap(newAggregation, name);
    } else if (current != null) {
      aggregation = MetricWrapper.rename(current, name);
    } else {
      throw new ValidationException("Metric query has no aggregation; supply one to update it");
    }
    ArrayNode single = JacksonUtility.nodes().arrayNode();
    single.add(aggregation);
    query.set(StructuredQuery.AGGREGATION, single);

    if (newFilter != null) {
      query.set(StructuredQuery.FILTER, newFilter.deepCopy());
    }
    return rewritten;
  }
}
