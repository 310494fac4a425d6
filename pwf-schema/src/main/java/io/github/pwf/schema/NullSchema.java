package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Null schema - always valid for null values
public record NullSchema() implements JsonSchema {
  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    if (json != null && !json.isNull()) {
      return ValidationResult.failure(
          Violation.of(location, "type", "Expected null", "type", "null"));
    }
    return ValidationResult.success();
  }
}
