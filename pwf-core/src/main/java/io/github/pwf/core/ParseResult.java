package io.github.pwf.core;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Outcome of parsing: either a schema-valid document or the issues that prevented it.
///
/// ```java
/// ParseResult<PlanDocument> result = Pwf.parsePlan(text);
/// if (result instanceof ParseResult.Parsed<PlanDocument> parsed) {
///     render(parsed.document());
/// } else {
///     showErrors(result.issues());
/// }
/// ```
public sealed interface ParseResult<D extends Document> permits ParseResult.Parsed, ParseResult.Issues {

  boolean isIssueList();

  /// The issues; empty for a parsed document
  List<ValidationIssue> issues();

  <R> R fold(Function<? super D, ? extends R> onDocument, Function<List<ValidationIssue>, ? extends R> onIssues);

  /// The document, or an `IllegalStateException` listing the issues
  D orElseThrow();

  record Parsed<D extends Document>(D document) implements ParseResult<D> {
    public Parsed {
      Objects.requireNonNull(document, "document");
    }

    @Override
    public boolean isIssueList() {
      return false;
    }

    @Override
    public List<ValidationIssue> issues() {
      return List.of();
    }

    @Override
    public <R> R fold(Function<? super D, ? extends R> onDocument, Function<List<ValidationIssue>, ? extends R> onIssues) {
      return onDocument.apply(document);
    }

    @Override
    public D orElseThrow() {
      return document;
    }
  }

  record Issues<D extends Document>(List<ValidationIssue> issues) implements ParseResult<D> {
    public Issues {
      issues = List.copyOf(issues);
      if (issues.isEmpty()) {
        throw new IllegalArgumentException("An issue result needs at least one issue");
      }
    }

    @Override
    public boolean isIssueList() {
      return true;
    }

    @Override
    public <R> R fold(Function<? super D, ? extends R> onDocument, Function<List<ValidationIssue>, ? extends R> onIssues) {
      return onIssues.apply(issues);
    }

    @Override
    public D orElseThrow() {
      throw new IllegalStateException("Document has " + issues.size() + " issue(s): "
          + issues.stream().map(ValidationIssue::toString).collect(Collectors.joining("; ")));
    }
  }
}
