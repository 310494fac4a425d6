package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/// Number schema with range and multiple constraints.
/// `integer` additionally rejects values with a fractional part (`3.0` is an integer).
public record NumberSchema(
    BigDecimal minimum,
    BigDecimal maximum,
    BigDecimal exclusiveMinimum,
    BigDecimal exclusiveMaximum,
    BigDecimal multipleOf,
    boolean integer
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    LOG.finest(() -> "NumberSchema.validateAt: " + json + " minimum=" + minimum + " maximum=" + maximum);
    String expected = integer ? "integer" : "number";
    if (json == null || !json.isNumber() || !JsonNodes.isFinite(json)) {
      return ValidationResult.failure(
          Violation.of(location, "type", "Expected " + expected, "type", expected));
    }

    BigDecimal value = json.decimalValue();
    if (integer && value.stripTrailingZeros().scale() > 0) {
      return ValidationResult.failure(
          Violation.of(location, "type", "Expected integer", "type", "integer"));
    }

    List<Violation> violations = new ArrayList<>();

    if (minimum != null && value.compareTo(minimum) < 0) {
      violations.add(Violation.of(location, "minimum", "Below minimum " + minimum, "limit", minimum));
    }
    if (exclusiveMinimum != null && value.compareTo(exclusiveMinimum) <= 0) {
      violations.add(Violation.of(location, "exclusiveMinimum",
          "Below exclusive minimum " + exclusiveMinimum, "limit", exclusiveMinimum));
    }
    if (maximum != null && value.compareTo(maximum) > 0) {
      violations.add(Violation.of(location, "maximum", "Above maximum " + maximum, "limit", maximum));
    }
    if (exclusiveMaximum != null && value.compareTo(exclusiveMaximum) >= 0) {
      violations.add(Violation.of(location, "exclusiveMaximum",
          "Above exclusive maximum " + exclusiveMaximum, "limit", exclusiveMaximum));
    }

    // Check multipleOf
    if (multipleOf != null && value.remainder(multipleOf).compareTo(BigDecimal.ZERO) != 0) {
      violations.add(Violation.of(location, "multipleOf", "Not multiple of " + multipleOf, "multipleOf", multipleOf));
    }

    return violations.isEmpty() ? ValidationResult.success() : ValidationResult.failure(violations);
  }
}
