package io.github.pwf.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A single schema violation as found by the validator.
///
/// - `location` points at the first structurally offending value. For `required` and
///   `additionalProperties` this is the containing object; the property name is in `params`.
/// - `keyword` is the schema keyword that failed (`required`, `type`, `enum`, ...).
/// - `params` carries keyword specific detail such as `missingProperty` or `additionalProperty`.
public record Violation(Location location, String keyword, Map<String, Object> params, String message) {

  public static final String MISSING_PROPERTY = "missingProperty";
  public static final String ADDITIONAL_PROPERTY = "additionalProperty";

  public Violation {
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(keyword, "keyword");
    Objects.requireNonNull(message, "message");
    params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  static Violation of(Location location, String keyword, String message) {
    return new Violation(location, keyword, Map.of(), message);
  }

  static Violation of(Location location, String keyword, String message, String param, Object value) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put(param, value);
    return new Violation(location, keyword, params, message);
  }

  /// String valued parameter or null when absent
  public String param(String name) {
    Object value = params.get(name);
    return value instanceof String s ? s : null;
  }
}
