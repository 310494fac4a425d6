package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Deque;

/// If/Then/Else conditional schema
public record ConditionalSchema(JsonSchema ifSchema, JsonSchema thenSchema,
                                JsonSchema elseSchema) implements JsonSchema {
  @Override
  public ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack) {
    // Step 1 - evaluate IF condition on an isolated stack
    boolean ifValid = JsonSchema.evaluateBranch(location, ifSchema, json).isEmpty();

    // Step 2 - choose branch
    JsonSchema branch = ifValid ? thenSchema : elseSchema;

    LOG.finer(() -> String.format(
        "Conditional location=%s ifValid=%b branch=%s",
        location, ifValid,
        branch == null ? "none" : (ifValid ? "then" : "else")));

    if (branch == null) {
      return ValidationResult.success();      // no branch → accept
    }

    // push branch onto SAME stack instead of direct call
    stack.push(new ValidationFrame(location, branch, json));
    return ValidationResult.success();          // real result emerges later
  }
}
