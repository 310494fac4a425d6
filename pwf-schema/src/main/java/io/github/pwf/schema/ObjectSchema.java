package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/// Object schema with properties, required fields, and constraints
public record ObjectSchema(
    Map<String, JsonSchema> properties,
    Set<String> required,
    JsonSchema additionalProperties,
    Integer minProperties,
    Integer maxProperties,
    Map<Pattern, JsonSchema> patternProperties,
    JsonSchema propertyNames,
    Map<String, Set<String>> dependentRequired
) implements JsonSchema {

  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    if (json == null || !json.isObject()) {
      return ValidationResult.failure(
          Violation.of(location, "type", "Expected object", "type", "object"));
    }

    List<Violation> violations = new ArrayList<>();

    // Check property count constraints
    int propCount = json.size();
    if (minProperties != null && propCount < minProperties) {
      violations.add(Violation.of(location, "minProperties",
          "Too few properties: expected at least " + minProperties, "limit", minProperties));
    }
    if (maxProperties != null && propCount > maxProperties) {
      violations.add(Violation.of(location, "maxProperties",
          "Too many properties: expected at most " + maxProperties, "limit", maxProperties));
    }

    // Check required properties
    for (String reqProp : required) {
      if (!json.has(reqProp)) {
        violations.add(Violation.of(location, "required",
            "Missing required property: " + reqProp, Violation.MISSING_PROPERTY, reqProp));
      }
    }

    // Handle dependentRequired
    if (dependentRequired != null) {
      for (var entry : dependentRequired.entrySet()) {
        String triggerProp = entry.getKey();
        if (!json.has(triggerProp)) {
          continue;
        }
        for (String depProp : entry.getValue()) {
          if (!json.has(depProp)) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("property", triggerProp);
            params.put(Violation.MISSING_PROPERTY, depProp);
            violations.add(new Violation(location, "dependentRequired", params,
                "Property '" + triggerProp + "' requires property '" + depProp + "' (dependentRequired)"));
          }
        }
      }
    }

    List<ValidationFrame> children = new ArrayList<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = json.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      String propName = entry.getKey();
      JsonNode propValue = entry.getValue();
      Location propLocation = location.child(propName);

      // Validate property names if specified
      if (propertyNames != null
          && !JsonSchema.evaluateBranch(propLocation, propertyNames, TextNode.valueOf(propName)).isEmpty()) {
        violations.add(Violation.of(location, "propertyNames",
            "Property name violates propertyNames: " + propName, "propertyName", propName));
      }

      // 1. Check if property is in properties (highest precedence)
      boolean handled = false;
      JsonSchema propSchema = properties.get(propName);
      if (propSchema != null) {
        children.add(new ValidationFrame(propLocation, propSchema, propValue));
        handled = true;
      }

      // 2. Check all patternProperties that match this property name
      if (patternProperties != null) {
        for (var patternEntry : patternProperties.entrySet()) {
          if (patternEntry.getKey().matcher(propName).find()) { // unanchored find semantics
            children.add(new ValidationFrame(propLocation, patternEntry.getValue(), propValue));
            handled = true;
          }
        }
      }

      // 3. If property wasn't handled by properties or patternProperties, apply additionalProperties
      if (!handled && additionalProperties != null) {
        if (additionalProperties == BooleanSchema.FALSE) {
          // reported against the object, the offending name travels as a parameter
          violations.add(Violation.of(location, "additionalProperties",
              "Additional properties not allowed: " + propName, Violation.ADDITIONAL_PROPERTY, propName));
        } else if (additionalProperties != BooleanSchema.TRUE) {
          children.add(new ValidationFrame(propLocation, additionalProperties, propValue));
        }
      }
    }
    JsonSchema.pushInOrder(stack, children);

    return violations.isEmpty() ? ValidationResult.success() : ValidationResult.failure(violations);
  }
}
