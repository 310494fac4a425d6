package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Const schema - validates that a value equals a constant
public record ConstSchema(JsonNode constValue) implements JsonSchema {
  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    return json != null && JsonNodes.sameValue(constValue, json) ?
        ValidationResult.success() :
        ValidationResult.failure(Violation.of(location, "const",
            "Value must equal const value " + constValue, "allowedValue", constValue));
  }
}
