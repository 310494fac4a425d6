package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Array schema with item validation and constraints
public record ArraySchema(
    JsonSchema items,
    Integer minItems,
    Integer maxItems,
    Boolean uniqueItems
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    if (json == null || !json.isArray()) {
      return ValidationResult.failure(
          Violation.of(location, "type", "Expected array", "type", "array"));
    }

    List<Violation> violations = new ArrayList<>();
    int itemCount = json.size();

    // Check item count constraints
    if (minItems != null && itemCount < minItems) {
      violations.add(Violation.of(location, "minItems",
          "Too few items: expected at least " + minItems, "limit", minItems));
    }
    if (maxItems != null && itemCount > maxItems) {
      violations.add(Violation.of(location, "maxItems",
          "Too many items: expected at most " + maxItems, "limit", maxItems));
    }

    // Check uniqueness if required (structural equality)
    if (uniqueItems != null && uniqueItems) {
      Set<String> seen = new HashSet<>();
      for (JsonNode item : json) {
        if (!seen.add(JsonNodes.canonicalize(item))) {
          violations.add(Violation.of(location, "uniqueItems", "Array items must be unique"));
          break;
        }
      }
    }

    if (items != null && items != AnySchema.INSTANCE && items != BooleanSchema.TRUE) {
      List<ValidationFrame> children = new ArrayList<>(itemCount);
      for (int index = 0; index < itemCount; index++) {
        children.add(new ValidationFrame(location.child(index), items, json.get(index)));
      }
      JsonSchema.pushInOrder(stack, children);
    }

    return violations.isEmpty() ? ValidationResult.success() : ValidationResult.failure(violations);
  }
}
