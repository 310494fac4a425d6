package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;
import java.util.List;

/// OneOf composition - must satisfy exactly one schema
public record OneOfSchema(List<JsonSchema> schemas) implements JsonSchema {

  public OneOfSchema {
    schemas = List.copyOf(schemas);
  }

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    int validCount = 0;
    List<Violation> minimalViolations = null;

    for (JsonSchema schema : schemas) {
      List<Violation> branchViolations = JsonSchema.evaluateBranch(location, schema, json);
      if (branchViolations.isEmpty()) {
        validCount++;
      } else if (minimalViolations == null
          || branchViolations.size() < minimalViolations.size()
          || (branchViolations.size() == minimalViolations.size() && !hasTypeMismatch(branchViolations))) {
        // Prefer the smallest violation set, and among equals one that is not a type mismatch
        minimalViolations = branchViolations;
      }
      LOG.finest(() -> "one of BRANCH END: " + branchViolations.size() + " violations");
    }

    if (validCount == 1) {
      return ValidationResult.success();
    } else if (validCount == 0) {
      return ValidationResult.failure(minimalViolations != null ? minimalViolations
          : List.of(Violation.of(location, "oneOf", "oneOf: no schemas to match")));
    }
    return ValidationResult.failure(Violation.of(location, "oneOf",
        "oneOf: multiple schemas matched (" + validCount + ")", "passingSchemas", validCount));
  }

  private static boolean hasTypeMismatch(List<Violation> violations) {
    return violations.stream().anyMatch(v -> "type".equals(v.keyword()));
  }
}
