package io.github.pwf.core;

/// Options threaded through validation and parsing.
///
/// `strict` is accepted for forward compatibility; schema validation is already
/// closed at every object level, so it does not change the outcome today.
public record ValidationOptions(boolean strict) {

  public static final ValidationOptions DEFAULT = new ValidationOptions(false);
  public static final ValidationOptions STRICT = new ValidationOptions(true);
}
