package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.pwf.schema.JsonSchema;
import io.github.pwf.schema.Violation;

import java.util.List;
import java.util.Objects;

import static io.github.pwf.core.PwfLogging.LOG;

/// Runs a candidate value against the schema of its kind.
/// Returns raw violations in document order; an empty list means the value is valid.
public final class Validator {

  private Validator() {}

  public static List<Violation> validate(JsonNode value, DocumentKind kind) {
    Objects.requireNonNull(kind, "kind");
    JsonNode candidate = value == null || value instanceof MissingNode ? NullNode.getInstance() : value;
    JsonSchema schema = SchemaRegistry.schemaFor(kind);
    List<Violation> violations = schema.validate(candidate).violations();
    StructuredLog.fine(LOG, "validate", "kind", kind, "violations", violations.size());
    return violations;
  }
}
