package com.gentoro.metabasemcp.metric;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized view of a saved metric.
 *
 * @param aggregationType operator tag of the metric's aggregation, {@code "unknown"} when the
 *     stored query has none
 */
public record MetricSummary(
    @JsonProperty("id") long id,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("aggregation_type") String aggregationType,
    @JsonProperty("has_filter") boolean hasFilter,
    @JsonProperty("collection_id") Long collectionId,
    @JsonProperty("collection_name") String collectionName,
    @JsonProperty("table_id") Long tableId,
    @JsonProperty("database_id") Long databaseId) {}
