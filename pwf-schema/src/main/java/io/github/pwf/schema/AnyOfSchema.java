package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// AnyOf composition - must satisfy at least one schema
public record AnyOfSchema(List<JsonSchema> schemas) implements JsonSchema {

  public AnyOfSchema {
    schemas = List.copyOf(schemas);
  }

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    List<Violation> collected = new ArrayList<>();

    for (JsonSchema schema : schemas) {
      LOG.finest(() -> "BRANCH START: " + schema.getClass().getSimpleName());
      List<Violation> branchViolations = JsonSchema.evaluateBranch(location, schema, json);
      if (branchViolations.isEmpty()) {
        return ValidationResult.success();
      }
      collected.addAll(branchViolations);
      LOG.finest(() -> "BRANCH END: " + branchViolations.size() + " violations");
    }

    return ValidationResult.failure(collected);
  }
}
