package io.github.pwf.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.github.pwf.core.PwfLogging.LOG;

/// Immutable lookup of converters by source format.
/// Converting from a format with no registered converter is a `Failed` result.
public final class ConverterRegistry {

  private final Map<SourceFormat, FormatConverter> converters;

  private ConverterRegistry(Map<SourceFormat, FormatConverter> converters) {
    this.converters = Collections.unmodifiableMap(new EnumMap<>(converters));
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ConverterRegistry empty() {
    return new ConverterRegistry(new EnumMap<>(SourceFormat.class));
  }

  public Set<SourceFormat> supportedFormats() {
    return converters.keySet();
  }

  public boolean supports(SourceFormat format) {
    return converters.containsKey(format);
  }

  public ConversionResult convert(SourceFormat format, byte[] input, boolean summaryOnly) {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(input, "input");
    FormatConverter converter = converters.get(format);
    if (converter == null) {
      StructuredLog.fine(LOG, "convert", "format", format, "outcome", "unsupported");
      return new ConversionResult.Failed("Unsupported format: " + format.extension());
    }
    ConversionResult result = invoke(converter, input, summaryOnly);
    StructuredLog.fine(LOG, "convert", "format", format, "bytes", input.length,
        "outcome", result instanceof ConversionResult.Converted ? "converted" : "failed");
    return result;
  }

  /// Runs a converter, turning a thrown exception or a missing result into `Failed`
  static ConversionResult invoke(FormatConverter converter, byte[] input, boolean summaryOnly) {
    ConversionResult result;
    try {
      result = converter.convert(input, summaryOnly);
    } catch (RuntimeException e) {
      StructuredLog.severe(LOG, "convert.threw", e, "converter", converter.getClass().getName());
      String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      return new ConversionResult.Failed("Conversion failed: " + detail);
    }
    if (result == null) {
      StructuredLog.severe(LOG, "convert.noResult", null, "converter", converter.getClass().getName());
      return new ConversionResult.Failed("Conversion failed: converter returned no result");
    }
    return result;
  }

  /// Converter bound to one format, usable with `Pwf.importHistory`
  public FormatConverter converterFor(SourceFormat format) {
    Objects.requireNonNull(format, "format");
    return (input, summaryOnly) -> convert(format, input, summaryOnly);
  }

  public static final class Builder {
    private final Map<SourceFormat, FormatConverter> converters = new EnumMap<>(SourceFormat.class);

    private Builder() {}

    public Builder register(SourceFormat format, FormatConverter converter) {
      converters.put(Objects.requireNonNull(format, "format"), Objects.requireNonNull(converter, "converter"));
      return this;
    }

    public ConverterRegistry build() {
      return new ConverterRegistry(converters);
    }
  }
}
