package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Not composition - inverts the validation result of the inner schema
public record NotSchema(JsonSchema schema) implements JsonSchema {
  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    return JsonSchema.evaluateBranch(location, schema, json).isEmpty() ?
        ValidationResult.failure(Violation.of(location, "not", "Schema should not match")) :
        ValidationResult.success();
  }
}
