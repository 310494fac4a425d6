package io.github.pwf.core;

/// Function-level contract of the external conversion engine.
/// Implementations must report bad input as `ConversionResult.Failed`, not by throwing.
@FunctionalInterface
public interface FormatConverter {

  /// @param input raw file content
  /// @param summaryOnly skip time-series telemetry when true
  ConversionResult convert(byte[] input, boolean summaryOnly);
}
