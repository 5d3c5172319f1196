package com.gentoro.metabasemcp.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Authenticated access to the Metabase REST API.
 *
 * <p>Paths are relative to the API root ({@code /dashboard/12}, not {@code /api/dashboard/12}).
 * Implementations return the parsed response document on success and throw {@link
 * com.gentoro.metabasemcp.exception.GatewayException} with the status and raw body otherwise. They
 * never retry.
 */
public interface Gateway {

  default JsonNode get(String path) {
    return send(HttpMethod.GET, path, null);
  }

  /**
   * @param body request document, ignored for {@link HttpMethod#GET}; may be null
   */
  JsonNode send(HttpMethod method, String path, JsonNode body);
}
