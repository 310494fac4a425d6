package io.github.pwf.core;

import java.util.List;
import java.util.Objects;

/// Outcome of an external format conversion
public sealed interface ConversionResult permits ConversionResult.Converted, ConversionResult.Failed {

  /// PWF history YAML plus the lossy-conversion warnings
  record Converted(String pwfYaml, List<ConversionWarning> warnings) implements ConversionResult {
    public Converted {
      Objects.requireNonNull(pwfYaml, "pwfYaml");
      warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
  }

  record Failed(String error) implements ConversionResult {
    public Failed {
      Objects.requireNonNull(error, "error");
    }
  }
}
