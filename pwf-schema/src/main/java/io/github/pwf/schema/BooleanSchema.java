package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Boolean schema - validates boolean values.
/// The `TRUE` and `FALSE` singletons stand for the boolean sub-schemas `true` and `false`.
public record BooleanSchema() implements JsonSchema {
  /// Singleton instances for boolean sub-schema handling
  static final BooleanSchema TRUE = new BooleanSchema();
  static final BooleanSchema FALSE = new BooleanSchema();

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    // For boolean subschemas, FALSE always fails, TRUE always passes
    if (this == FALSE) {
      return ValidationResult.failure(Violation.of(location, "false schema", "Schema should not match"));
    }
    if (this == TRUE) {
      return ValidationResult.success();
    }
    if (json == null || !json.isBoolean()) {
      return ValidationResult.failure(
          Violation.of(location, "type", "Expected boolean", "type", "boolean"));
    }
    return ValidationResult.success();
  }
}
