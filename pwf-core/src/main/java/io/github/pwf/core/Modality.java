package io.github.pwf.core;

import java.util.Locale;
import java.util.Optional;

/// How an exercise is performed and tracked
public enum Modality {
  STRENGTH,
  COUNTDOWN,
  STOPWATCH,
  INTERVAL,
  CYCLING,
  RUNNING,
  ROWING,
  SWIMMING;

  /// Lowercase name used in documents
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Modality> fromWireName(String value) {
    for (Modality modality : values()) {
      if (modality.wireName().equals(value)) {
        return Optional.of(modality);
      }
    }
    return Optional.empty();
  }
}
