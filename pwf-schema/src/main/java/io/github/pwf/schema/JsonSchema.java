package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// JSON Schema public API entry point
///
/// This interface provides the public API for compiling and validating schemas
/// while delegating implementation details to the keyword records
///
/// ## Usage
/// ```java
/// // Compile schema once (thread-safe, reusable)
/// JsonSchema schema = JsonSchema.compile(mapper.readTree(schemaJson));
///
/// // Validate documents already decoded into a JsonNode tree
/// ValidationResult result = schema.validate(document);
///
/// if (!result.valid()){
///     for (var violation : result.violations()){
///         System.out.println(violation.location() + ": " + violation.message());
///     }
/// }
/// ```
public sealed interface JsonSchema
    permits ObjectSchema,
    ArraySchema,
    StringSchema,
    NumberSchema,
    BooleanSchema,
    NullSchema,
    AnySchema,
    RefSchema,
    AllOfSchema,
    AnyOfSchema,
    OneOfSchema,
    ConditionalSchema,
    ConstSchema,
    NotSchema,
    EnumSchema {

  /// Shared logger
  Logger LOG = SchemaLogging.LOG;

  /// Options for schema compilation
  record JsonSchemaOptions(boolean assertFormats) {
    /// Default options with format assertion disabled
    public static final JsonSchemaOptions DEFAULT = new JsonSchemaOptions(false);

    /// Options asserting `format` keywords
    public static final JsonSchemaOptions STRICT_FORMATS = new JsonSchemaOptions(true);

    String summary() {
      return "assertFormats=" + assertFormats;
    }
  }

  /// Factory method to create schema from JSON Schema document
  ///
  /// @param schemaJson JSON Schema document as JsonNode
  /// @return Immutable JsonSchema instance
  /// @throws IllegalArgumentException if schema is invalid
  static JsonSchema compile(JsonNode schemaJson) {
    return compile(schemaJson, JsonSchemaOptions.DEFAULT);
  }

  /// Factory method to create schema from JSON Schema document with options
  ///
  /// @param schemaJson JSON Schema document as JsonNode
  /// @param options compilation options
  /// @return Immutable JsonSchema instance
  /// @throws IllegalArgumentException if schema is invalid
  static JsonSchema compile(JsonNode schemaJson, JsonSchemaOptions options) {
    Objects.requireNonNull(schemaJson, "schemaJson");
    Objects.requireNonNull(options, "options");
    LOG.fine(() -> "compile: start options=" + options.summary() + ", schema type=" + schemaJson.getNodeType());
    JsonSchema result = SchemaCompiler.compile(schemaJson, options);
    LOG.fine(() -> "compile: done result type=" + result.getClass().getSimpleName());
    return result;
  }

  /// Validates a JSON document against this schema
  ///
  /// @param json JSON value to validate
  /// @return ValidationResult with the violations in document order
  default ValidationResult validate(JsonNode json) {
    Objects.requireNonNull(json, "json");
    LOG.fine(() -> "validate: start schema=" + getClass().getSimpleName());
    List<Violation> violations = new ArrayList<>();
    Deque<ValidationFrame> stack = new ArrayDeque<>();
    Set<ValidationKey> visited = new HashSet<>();
    stack.push(new ValidationFrame(Location.ROOT, this, json));

    int iterationCount = 0;
    int maxDepthObserved = 0;
    final int WARNING_THRESHOLD = 10_000;

    while (!stack.isEmpty()) {
      iterationCount++;
      if (stack.size() > maxDepthObserved) maxDepthObserved = stack.size();
      if (iterationCount % WARNING_THRESHOLD == 0) {
        final int processed = iterationCount;
        final int pending = stack.size();
        final int maxDepth = maxDepthObserved;
        LOG.fine(() -> "PERFORMANCE WARNING: Validation stack processed=" + processed + " pending=" + pending + " maxDepth=" + maxDepth);
      }

      ValidationFrame frame = stack.pop();
      ValidationKey key = new ValidationKey(frame.schema(), frame.json(), frame.location());
      if (!visited.add(key)) {
        LOG.finest(() -> "SKIP " + frame.location() + "   schema=" + frame.schema().getClass().getSimpleName());
        continue;
      }
      LOG.finest(() -> "POP " + frame.location() + "   schema=" + frame.schema().getClass().getSimpleName());
      ValidationResult result = frame.schema().validateAt(frame.location(), frame.json(), stack);
      if (!result.valid()) {
        violations.addAll(result.violations());
      }
    }

    final int frames = iterationCount;
    final int found = violations.size();
    LOG.fine(() -> "validate: done frames=" + frames + " violations=" + found);
    return violations.isEmpty() ? ValidationResult.success() : ValidationResult.failure(violations);
  }

  /// Internal validation method used by stack-based traversal.
  /// Implementations push child frames in reverse so that they pop in document order.
  ValidationResult validateAt(Location location, JsonNode json, Deque<ValidationFrame> stack);

  /// Runs a schema on an isolated stack, used by combinators that must know a branch outcome
  static List<Violation> evaluateBranch(Location location, JsonSchema schema, JsonNode json) {
    Deque<ValidationFrame> branchStack = new ArrayDeque<>();
    List<Violation> branchViolations = new ArrayList<>();
    branchStack.push(new ValidationFrame(location, schema, json));
    while (!branchStack.isEmpty()) {
      ValidationFrame frame = branchStack.pop();
      ValidationResult result = frame.schema().validateAt(frame.location(), frame.json(), branchStack);
      if (!result.valid()) {
        branchViolations.addAll(result.violations());
      }
    }
    return branchViolations;
  }

  /// Pushes frames so that the first element of `frames` is popped first
  static void pushInOrder(Deque<ValidationFrame> stack, List<ValidationFrame> frames) {
    for (int i = frames.size() - 1; i >= 0; i--) {
      stack.push(frames.get(i));
    }
  }

  /// Validation result types
  record ValidationResult(boolean valid, List<Violation> violations) {
    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

    public ValidationResult {
      violations = List.copyOf(violations);
    }

    public static ValidationResult success() {
      return SUCCESS;
    }

    public static ValidationResult failure(List<Violation> violations) {
      return new ValidationResult(false, violations);
    }

    public static ValidationResult failure(Violation violation) {
      return new ValidationResult(false, List.of(violation));
    }
  }

  /// Validation frame for stack-based processing
  record ValidationFrame(Location location, JsonSchema schema, JsonNode json) {
  }

  /// Internal key used to detect and break validation cycles
  record ValidationKey(JsonSchema schema, JsonNode json, Location location) {

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof ValidationKey other)) {
        return false;
      }
      return this.schema == other.schema &&
          this.json == other.json &&
          Objects.equals(this.location, other.location);
    }

    @Override
    public int hashCode() {
      int result = System.identityHashCode(schema);
      result = 31 * result + System.identityHashCode(json);
      result = 31 * result + (location != null ? location.hashCode() : 0);
      return result;
    }
  }

  /// Resolver context for validation-time local `$ref` resolution
  record ResolverContext(java.util.Map<String, JsonSchema> localPointerIndex) {

    /// Resolve a pointer such as `#/$defs/Day` to the compiled target schema
    JsonSchema resolve(String pointer) {
      String key = pointer.isEmpty() ? SchemaCompiler.POINTER_ROOT : pointer;
      JsonSchema target = localPointerIndex.get(key);
      if (target == null) {
        throw new IllegalArgumentException("Unresolved $ref: " + pointer);
      }
      return target;
    }
  }
}
