package com.gentoro.metabasemcp.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the {@code arguments} object of a tool call. Missing or mistyped arguments raise
 * {@link ValidationException} before any remote call is made. A JSON {@code null} counts as
 * absent.
 */
public class ToolArguments {
  private final ObjectNode arguments;

  public ToolArguments(JsonNode arguments) {
    if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
      this.arguments = JacksonUtility.nodes().objectNode();
    } else if (arguments.isObject()) {
      this.arguments = (ObjectNode) arguments;
    } else {
      throw new ValidationException("Tool arguments must be a JSON object");
    }
  }

  public boolean has(String name) {
    JsonNode value = arguments.get(name);
    return value != null && !value.isNull();
  }

  public JsonNode node(String name) {
    return has(name) ? arguments.get(name) : null;
  }

  public long requireLong(String name) {
    Long value = optionalLong(name);
    if (value == null) {
      throw new ValidationException("Missing required argument: " + name);
    }
    return value;
  }

  public Long optionalLong(String name) {
    JsonNode value = node(name);
    if (value == null) return null;
    if (value.isIntegralNumber()) return value.asLong();
    if (value.isTextual()) {
      try {
        return Long.parseLong(value.asText().trim());
      } catch (NumberFormatException e) {
        throw new ValidationException("Argument '" + name + "' must be an integer", e);
      }
    }
    throw new ValidationException("Argument '" + name + "' must be an integer");
  }

  public int optionalInt(String name, int defaultValue) {
    Integer value = optionalInt(name);
    return value == null ? defaultValue : value;
  }

  public Integer optionalInt(String name) {
    Long value = optionalLong(name);
    if (value == null) return null;
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new ValidationException("Argument '" + name + "' is out of range");
    }
    return value.intValue();
  }

  public String requireText(String name) {
    String value = optionalText(name);
    if (value == null || value.isBlank()) {
      throw new ValidationException("Missing required argument: " + name);
    }
    return value;
  }

  public String optionalText(String name) {
    JsonNode value = node(name);
    if (value == null) return null;
    if (!value.isValueNode()) {
      throw new ValidationException("Argument '" + name + "' must be a string");
    }
    return value.asText();
  }

  public boolean optionalBoolean(String name, boolean defaultValue) {
    JsonNode value = node(name);
    if (value == null) return defaultValue;
    if (value.isBoolean()) return value.asBoolean();
    if (value.isTextual()) return Boolean.parseBoolean(value.asText());
    throw new ValidationException("Argument '" + name + "' must be a boolean");
  }

  public JsonNode requireNode(String name) {
    JsonNode value = node(name);
    if (value == null) {
      throw new ValidationException("Missing required argument: " + name);
    }
    return value;
  }

  public JsonNode optionalArray(String name) {
    JsonNode value = node(name);
    if (value != null && !value.isArray()) {
      throw new ValidationException("Argument '" + name + "' must be an array");
    }
    return value;
  }

  public ObjectNode optionalObject(String name) {
    JsonNode value = node(name);
    if (value != null && !value.isObject()) {
      throw new ValidationException("Argument '" + name + "' must be an object");
    }
    return (ObjectNode) value;
  }

  /** Elements of an array argument; empty when absent. */
  public List<JsonNode> list(String name) {
    JsonNode array = optionalArray(name);
    List<JsonNode> items = new ArrayList<>();
    if (array != null) {
      array.forEach(items::add);
    }
    return items;
  }

  /** Entries of an object argument, in document order; empty when absent. */
  public Map<String, JsonNode> map(String name) {
    ObjectNode object = optionalObject(name);
    Map<String, JsonNode> entries = new LinkedHashMap<>();
    if (object != null) {
      Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        entries.put(field.getKey(), field.getValue());
      }
    }
    return entries;
  }

  public ObjectNode raw() {
    return arguments;
  }
}
