package io.github.pwf.core;

import java.util.Locale;
import java.util.Optional;

/// Formats that an external converter can turn into a PWF history export
public enum SourceFormat {
  FIT("fit"),
  TCX("tcx"),
  GPX("gpx"),
  CSV("csv");

  private final String extension;

  SourceFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  /// Format for a file name by its extension, case-insensitive
  public static Optional<SourceFormat> fromFileName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return Optional.empty();
    }
    String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (SourceFormat format : values()) {
      if (format.extension.equals(ext)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
