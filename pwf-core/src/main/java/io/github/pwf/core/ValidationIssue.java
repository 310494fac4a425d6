package io.github.pwf.core;

import java.util.Objects;

/// A single structural problem in a candidate document.
///
/// - `path` is the canonical location, see `PathResolver`; `""` is the document root.
/// - `message` passes through from the validator or decoder verbatim.
/// - `code` is the violated schema keyword when known, otherwise null.
public record ValidationIssue(String path, String message, Severity severity, String code) {

  public ValidationIssue {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(severity, "severity");
  }

  public static ValidationIssue error(String path, String message) {
    return new ValidationIssue(path, message, Severity.ERROR, null);
  }

  public static ValidationIssue error(String path, String message, String code) {
    return new ValidationIssue(path, message, Severity.ERROR, code);
  }

  @Override
  public String toString() {
    String where = path.isEmpty() ? "<root>" : path;
    return severity.label() + " " + where + ": " + message;
  }
}
