package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.pwf.schema.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.pwf.core.PwfLogging.LOG;

/// Entry points for validating, parsing and serializing PWF documents.
///
/// Untrusted input never throws: malformed text and schema-invalid documents both come
/// back as a list of `ValidationIssue`s. All methods are stateless and thread-safe.
public final class Pwf {

  private Pwf() {}

  // Validation

  public static List<ValidationIssue> validatePlan(JsonNode value) {
    return validateDocument(value, DocumentKind.PLAN, ValidationOptions.DEFAULT);
  }

  public static List<ValidationIssue> validatePlan(JsonNode value, ValidationOptions options) {
    return validateDocument(value, DocumentKind.PLAN, options);
  }

  /// Validates a built plan, e.g. the output of `PlanBuilder.build()`
  public static List<ValidationIssue> validatePlan(PlanDocument plan) {
    Objects.requireNonNull(plan, "plan");
    return validateDocument(plan.tree(), DocumentKind.PLAN, ValidationOptions.DEFAULT);
  }

  public static List<ValidationIssue> validateHistory(JsonNode value) {
    return validateDocument(value, DocumentKind.HISTORY, ValidationOptions.DEFAULT);
  }

  public static List<ValidationIssue> validateHistory(JsonNode value, ValidationOptions options) {
    return validateDocument(value, DocumentKind.HISTORY, options);
  }

  public static List<ValidationIssue> validateDocument(JsonNode value, DocumentKind kind, ValidationOptions options) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(options, "options");
    List<Violation> violations = Validator.validate(value, kind);
    List<ValidationIssue> issues = new ArrayList<>(violations.size());
    for (Violation violation : violations) {
      issues.add(ValidationIssue.error(PathResolver.resolve(violation), violation.message(), violation.keyword()));
    }
    return List.copyOf(issues);
  }

  // Parsing

  public static ParseResult<PlanDocument> parsePlan(String text) {
    return parsePlan(text, ValidationOptions.DEFAULT);
  }

  public static ParseResult<PlanDocument> parsePlan(String text, ValidationOptions options) {
    return parseAs(text, DocumentKind.PLAN, options);
  }

  public static ParseResult<HistoryDocument> parseHistory(String text) {
    return parseHistory(text, ValidationOptions.DEFAULT);
  }

  public static ParseResult<HistoryDocument> parseHistory(String text, ValidationOptions options) {
    return parseAs(text, DocumentKind.HISTORY, options);
  }

  public static ParseResult<Document> parseDocument(String text, DocumentKind kind, ValidationOptions options) {
    return parseAs(text, kind, options);
  }

  @SuppressWarnings("unchecked")
  private static <D extends Document> ParseResult<D> parseAs(String text, DocumentKind kind, ValidationOptions options) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(options, "options");

    DecodeResult decoded = Serializer.decode(text);
    if (decoded instanceof DecodeResult.Failed failed) {
      StructuredLog.fine(LOG, "parse", "kind", kind, "outcome", "decode-failed");
      return new ParseResult.Issues<>(List.of(ValidationIssue.error("", failed.message())));
    }
    JsonNode value = ((DecodeResult.Decoded) decoded).value();

    List<ValidationIssue> issues = validateDocument(value, kind, options);
    if (!issues.isEmpty()) {
      StructuredLog.fine(LOG, "parse", "kind", kind, "outcome", "invalid", "issues", issues.size());
      return new ParseResult.Issues<>(issues);
    }
    StructuredLog.fine(LOG, "parse", "kind", kind, "outcome", "valid");
    // Document.of returns the concrete type for kind
    return new ParseResult.Parsed<>((D) Document.of(kind, value));
  }

  /// True when `value` is a list of issues: a `ParseResult.Issues`, or a `List` whose
  /// every element is a `ValidationIssue` (so the empty list qualifies).
  public static boolean isValidationIssueList(Object value) {
    if (value instanceof ParseResult<?> result) {
      return result.isIssueList();
    }
    if (!(value instanceof List<?> list)) {
      return false;
    }
    for (Object item : list) {
      if (!(item instanceof ValidationIssue)) {
        return false;
      }
    }
    return true;
  }

  // Text form

  public static String toYaml(Document document) {
    return Serializer.encode(document);
  }

  /// Decodes YAML text without validating it
  /// @throws IllegalArgumentException when the text is not well formed
  public static JsonNode fromYaml(String text) {
    DecodeResult decoded = Serializer.decode(text);
    if (decoded instanceof DecodeResult.Failed failed) {
      throw new IllegalArgumentException("Malformed YAML: " + failed.message());
    }
    return ((DecodeResult.Decoded) decoded).value();
  }

  // Conversion

  /// Converts raw bytes from another format and parses the result as a history export.
  /// A failed conversion, a converter exception or a missing result becomes a single root
  /// issue carrying the error.
  public static HistoryImport importHistory(FormatConverter converter, byte[] input) {
    Objects.requireNonNull(converter, "converter");
    Objects.requireNonNull(input, "input");
    ConversionResult conversion = ConverterRegistry.invoke(converter, input, false);
    if (conversion instanceof ConversionResult.Failed failed) {
      StructuredLog.fine(LOG, "import", "outcome", "conversion-failed");
      return new HistoryImport(new ParseResult.Issues<>(List.of(ValidationIssue.error("", failed.error()))), List.of());
    }
    ConversionResult.Converted converted = (ConversionResult.Converted) conversion;
    StructuredLog.fine(LOG, "import", "outcome", "converted", "warnings", converted.warnings().size());
    return new HistoryImport(parseHistory(converted.pwfYaml()), converted.warnings());
  }
}
