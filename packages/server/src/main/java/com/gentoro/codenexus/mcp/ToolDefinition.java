package com.gentoro.codenexus.mcp;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-agnostic description of one MCP tool: its name, its arguments and the handler that
 * serves it. {@link McpServer} turns these into SDK tool specifications.
 */
public final class ToolDefinition {
  private final String name;
  private final String description;
  private final List<ToolProperty> parameters;
  private final ToolHandler handler;

  public ToolDefinition(
      String name, String description, List<ToolProperty> parameters, ToolHandler handler) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = Objects.requireNonNull(description, "description");
    this.parameters = List.copyOf(parameters);
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public List<ToolProperty> parameters() {
    return parameters;
  }

  public ToolHandler handler() {
    return handler;
  }

  /** Parameter name to JSON-Schema fragment, in declaration order. */
  public Map<String, Object> schemaProperties() {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (ToolProperty parameter : parameters) {
      properties.put(parameter.name(), parameter.toSchema());
    }
    return properties;
  }

  public List<String> requiredParameters() {
    return parameters.stream().filter(ToolProperty::required).map(ToolProperty::name).toList();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private final List<ToolProperty> parameters = new ArrayList<>();
    private ToolHandler handler;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder parameter(ToolProperty parameter) {
      this.parameters.add(parameter);
      return this;
    }

    public Builder handler(ToolHandler handler) {
      this.handler = handler;
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, description, parameters, handler);
    }
  }
}
