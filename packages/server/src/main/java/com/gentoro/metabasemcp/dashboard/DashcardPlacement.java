package com.gentoro.metabasemcp.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.utility.JacksonUtility;

/**
 * Where and how to place a card on a dashboard.
 *
 * @param tabId owning tab, or null for dashboards without tabs
 * @param parameterMappings mapping documents; entries without {@code card_id} are pinned to {@code
 *     cardId}
 */
public record DashcardPlacement(
    long cardId,
    Long tabId,
    int row,
    int col,
    int sizeX,
    int sizeY,
    JsonNode parameterMappings,
    JsonNode visualizationSettings) {
  public static final int DEFAULT_SIZE_X = 4;
  public static final int DEFAULT_SIZE_Y = 4;

  public DashcardPlacement {
    if (row < 0 || col < 0) {
      throw new ValidationException("Dashcard row and col must not be negative");
    }
    if (sizeX <= 0 || sizeY <= 0) {
      throw new ValidationException("Dashcard size_x and size_y must be positive");
    }
    if (parameterMappings != null && !parameterMappings.isNull() && !parameterMappings.isArray()) {
      throw new ValidationException("parameter_mappings must be an array");
    }
    if (visualizationSettings != null
        && !visualizationSettings.isNull()
        && !visualizationSettings.isObject()) {
      throw new ValidationException("visualization_settings must be an object");
    }
  }

  public static DashcardPlacement of(long cardId) {
    return new DashcardPlacement(cardId, null, 0, 0, DEFAULT_SIZE_X, DEFAULT_SIZE_Y, null, null);
  }

  Dashcard toDashcard(long id) {
    ObjectNode node = JacksonUtility.nodes().objectNode();
    node.put("id", id);
    node.put("card_id", cardId);
    if (tabId == null) {
      node.putNull(Dashcard.TAB_ID);
    } else {
      node.put(Dashcard.TAB_ID, tabId);
    }
    node.put("row", row);
    node.put("col", col);
    node.put("size_x", sizeX);
    node.put("size_y", sizeY);

    ArrayNode mappings = node.putArray(Dashcard.PARAMETER_MAPPINGS);
    if (parameterMappings != null && parameterMappings.isArray()) {
      for (JsonNode mapping : parameterMappings) {
        ObjectNode copy = mapping.isObject() ? ((ObjectNode) mapping).deepCopy() : null;
        if (copy == null) {
          throw new ValidationException("Each parameter mapping must be an object");
        }
        if (!copy.hasNonNull("card_id")) {
          copy.put("card_id", cardId);
        }
        mappings.add(copy);
      }
    }
    if (visualizationSettings != null && visualizationSettings.isObject()) {
      node.set("visualization_settings", visualizationSettings.deepCopy());
    } else {
      node.putObject("visualization_settings");
    }
    return new Dashcard(node);
  }
}
