package io.github.pwf.core;

import java.util.Locale;

/// Issue severity. Every schema finding is an `ERROR`; `WARNING` is reserved for soft rules.
public enum Severity {
  ERROR,
  WARNING;

  /// Lowercase wire form, `error` or `warning`
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return label();
  }
}
