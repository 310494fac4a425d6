package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// Reference schema for a local JSON Schema `$ref` such as `#/$defs/Exercise`
public record RefSchema(String pointer, ResolverContext resolverContext) implements JsonSchema {
  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    LOG.finest(() -> "RefSchema.validateAt: " + pointer + " at location: " + location);
    JsonSchema target = resolverContext.resolve(pointer);
    // Stay on the SAME traversal stack (uniform non-recursive execution).
    stack.push(new ValidationFrame(location, target, json));
    return ValidationResult.success();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RefSchema other
        && pointer.equals(other.pointer)
        && resolverContext == other.resolverContext;
  }

  @Override
  public int hashCode() {
    return 31 * pointer.hashCode() + System.identityHashCode(resolverContext);
  }

  @Override
  public String toString() {
    return "RefSchema[" + pointer + "]";
  }
}
