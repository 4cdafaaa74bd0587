package com.gentoro.codenexus.mcp;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One named argument of a {@link ToolDefinition}, rendered as a JSON-Schema property. */
public final class ToolProperty {
  public enum Type {
    STRING,
    INTEGER,
    ARRAY
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final Type itemType;

  public ToolProperty(
      String name, String description, boolean required, Type type, Type itemType) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
    this.required = required;
    this.type = Objects.requireNonNull(type, "type");
    this.itemType = itemType;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public boolean required() {
    return required;
  }

  public Type type() {
    return type;
  }

  /** JSON-Schema fragment, e.g. {@code {"type": "array", "items": {"type": "string"}}}. */
  public Map<String, Object> toSchema() {
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", schemaType(type));
    if (description != null) {
      schema.put("description", description);
    }
    if (type == Type.ARRAY) {
      schema.put("items", Map.of("type", schemaType(itemType == null ? Type.STRING : itemType)));
    }
    return schema;
  }

  private static String schemaType(Type type) {
    return type.name().toLowerCase(java.util.Locale.ROOT);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private boolean required = true;
    private Type type = Type.STRING;
    private Type itemType;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder items(Type itemType) {
      this.itemType = itemType;
      return this;
    }

    public ToolProperty build() {
      return new ToolProperty(name, description, required, type, itemType);
    }
  }
}
