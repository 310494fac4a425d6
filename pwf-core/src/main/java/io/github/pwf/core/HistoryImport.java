package io.github.pwf.core;

import java.util.List;
import java.util.Objects;

/// Result of `Pwf.importHistory`: the parsed export and any conversion warnings
public record HistoryImport(ParseResult<HistoryDocument> result, List<ConversionWarning> warnings) {

  public HistoryImport {
    Objects.requireNonNull(result, "result");
    warnings = List.copyOf(warnings);
  }
}
