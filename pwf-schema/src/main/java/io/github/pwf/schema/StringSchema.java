package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/// String schema with length, pattern, and format constraints
public record StringSchema(
    Integer minLength,
    Integer maxLength,
    Pattern pattern,
    Format format,
    boolean assertFormats
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    if (json == null || !json.isTextual()) {
      return ValidationResult.failure(
          Violation.of(location, "type", "Expected string", "type", "string"));
    }

    String value = json.textValue();
    List<Violation> violations = new ArrayList<>();

    // Length counts code points, not UTF-16 units
    int length = value.codePointCount(0, value.length());
    if (minLength != null && length < minLength) {
      violations.add(Violation.of(location, "minLength",
          "String too short: expected at least " + minLength + " characters", "limit", minLength));
    }
    if (maxLength != null && length > maxLength) {
      violations.add(Violation.of(location, "maxLength",
          "String too long: expected at most " + maxLength + " characters", "limit", maxLength));
    }

    // Check pattern (unanchored matching - uses find() instead of matches())
    if (pattern != null && !pattern.matcher(value).find()) {
      violations.add(Violation.of(location, "pattern",
          "Pattern mismatch: " + pattern.pattern(), "pattern", pattern.pattern()));
    }

    // Check format validation (only when format assertion is enabled)
    if (format != null && assertFormats && !format.test(value)) {
      violations.add(Violation.of(location, "format",
          "Invalid format '" + format.wireName() + "'", "format", format.wireName()));
    }

    return violations.isEmpty() ? ValidationResult.success() : ValidationResult.failure(violations);
  }
}
