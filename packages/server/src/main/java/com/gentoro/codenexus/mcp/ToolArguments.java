package com.gentoro.codenexus.mcp;

import com.gentoro.codenexus.exception.ConfigException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Typed access to the raw argument map of a tool call. */
public final class ToolArguments {
  private final Map<String, Object> values;

  public ToolArguments(Map<String, Object> values) {
    this.values = values == null ? Map.of() : values;
  }

  /**
   * @throws ConfigException if the argument is missing or blank
   */
  public String requireString(String name) {
    Object value = values.get(name);
    if (value == null || value.toString().isBlank()) {
      throw new ConfigException("Missing required argument: " + name);
    }
    return value.toString();
  }

  public String optionalString(String name) {
    Object value = values.get(name);
    return value == null ? null : value.toString();
  }

  /**
   * @throws ConfigException if the value is not a whole number
   */
  public Integer optionalInt(String name) {
    Object value = values.get(name);
    if (value == null) return null;
    if (value instanceof Number number) return number.intValue();
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigException("Argument " + name + " must be an integer: " + value, e);
    }
  }

  /**
   * A string array argument. A single string is accepted as a one-element list.
   *
   * @throws ConfigException if the argument is missing
   */
  public List<String> requireStringList(String name) {
    Object value = values.get(name);
    if (value == null) {
      throw new ConfigException("Missing required argument: " + name);
    }
    if (value instanceof Collection<?> items) {
      List<String> result = new ArrayList<>(items.size());
      for (Object item : items) {
        if (item != null) result.add(item.toString());
      }
      return result;
    }
    return List.of(value.toString());
  }
}
