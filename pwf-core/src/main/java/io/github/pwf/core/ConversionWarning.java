package io.github.pwf.core;

import java.util.Objects;

/// A lossy-conversion note reported by a converter alongside its output
public record ConversionWarning(Type type, String field, String message) {

  public enum Type {
    MISSING_FIELD,
    VALUE_CLAMPED,
    UNSUPPORTED_FEATURE,
    TIME_SERIES_SKIPPED,
    DATA_QUALITY_ISSUE
  }

  public ConversionWarning {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(message, "message");
  }

  public static ConversionWarning missingField(String sourceField, String reason) {
    return new ConversionWarning(Type.MISSING_FIELD, sourceField, "Missing field '" + sourceField + "': " + reason);
  }

  public static ConversionWarning valueClamped(String field, String original, String clamped) {
    return new ConversionWarning(Type.VALUE_CLAMPED, field,
        "Value clamped in '" + field + "': " + original + " -> " + clamped);
  }

  public static ConversionWarning unsupportedFeature(String feature) {
    return new ConversionWarning(Type.UNSUPPORTED_FEATURE, null, "Unsupported feature: " + feature);
  }

  public static ConversionWarning timeSeriesSkipped(String reason) {
    return new ConversionWarning(Type.TIME_SERIES_SKIPPED, null, "Time-series data skipped: " + reason);
  }

  public static ConversionWarning dataQualityIssue(String issue) {
    return new ConversionWarning(Type.DATA_QUALITY_ISSUE, null, "Data quality issue: " + issue);
  }
}
