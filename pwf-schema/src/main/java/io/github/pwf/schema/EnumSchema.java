package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// Enum schema - validates that a value is in a list of allowed values
public record EnumSchema(JsonSchema baseSchema, List<JsonNode> allowedValues) implements JsonSchema {

  public EnumSchema {
    allowedValues = List.copyOf(allowedValues);
  }

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    // First validate against base schema
    ValidationResult baseResult = baseSchema.validateAt(location, json, stack);
    if (!baseResult.valid()) {
      return baseResult;
    }

    for (JsonNode allowed : allowedValues) {
      if (JsonNodes.sameValue(allowed, json)) {
        return ValidationResult.success();
      }
    }
    return ValidationResult.failure(Violation.of(location, "enum",
        "Not in enum: must be one of " + allowedValues, "allowedValues", allowedValues));
  }
}
