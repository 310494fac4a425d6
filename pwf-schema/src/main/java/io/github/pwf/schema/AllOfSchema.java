package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// AllOf composition - must satisfy all schemas
public record AllOfSchema(List<JsonSchema> schemas) implements JsonSchema {

  public AllOfSchema {
    schemas = List.copyOf(schemas);
  }

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    List<ValidationFrame> frames = new ArrayList<>(schemas.size());
    for (JsonSchema schema : schemas) {
      frames.add(new ValidationFrame(location, schema, json));
    }
    JsonSchema.pushInOrder(stack, frames);
    return ValidationResult.success(); // Actual results emerge from stack processing
  }
}
