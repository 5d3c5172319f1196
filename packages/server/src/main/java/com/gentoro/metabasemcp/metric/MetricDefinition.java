package com.gentoro.metabasemcp.metric;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Input for creating a metric: one aggregation over one table, optionally filtered. */
public record MetricDefinition(
    String name,
    long databaseId,
    long tableId,
    JsonNode aggregation,
    JsonNode filter,
    List<JsonNode> breakouts,
    String description,
    Long collectionId) {}
