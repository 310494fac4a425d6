package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Any schema - accepts all values
public record AnySchema() implements JsonSchema {
  static final AnySchema INSTANCE = new AnySchema();

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    return ValidationResult.success();
  }
}
