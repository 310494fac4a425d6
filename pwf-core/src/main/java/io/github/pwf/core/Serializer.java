package io.github.pwf.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

import static io.github.pwf.core.PwfLogging.LOG;

/// Block style YAML text form of PWF documents.
///
/// Purely structural: no schema awareness. Strings are always quoted so that values such
/// as `"1rm"`, `"2024-01-15"` or `"yes"` decode back as the same strings, and lines are never
/// wrapped. `decode(encode(document))` equals the document tree.
public final class Serializer {

  private static final YAMLMapper MAPPER = YAMLMapper.builder()
      .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
      .disable(YAMLGenerator.Feature.SPLIT_LINES)
      .disable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
      .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
      .build();

  private Serializer() {}

  public static String encode(Document document) {
    Objects.requireNonNull(document, "document");
    return encode(document.tree());
  }

  public static String encode(JsonNode value) {
    Objects.requireNonNull(value, "value");
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      // A tree of plain JSON nodes always has a YAML rendering
      throw new UncheckedIOException("Failed to encode document", e);
    }
  }

  /// Decodes a single YAML document. Anchors and aliases are resolved. Malformed text,
  /// including duplicate mapping keys, unknown aliases and a second document in the stream,
  /// is a `Failed` result carrying the decoder message. Empty text decodes to null.
  public static DecodeResult decode(String text) {
    Objects.requireNonNull(text, "text");
    try (YAMLParser parser = MAPPER.getFactory().createParser(text)) {
      return new DecodeResult.Decoded(new YamlTreeReader(parser).readDocument());
    } catch (IOException e) {
      String message = e instanceof JsonProcessingException processing ? processing.getOriginalMessage() : e.getMessage();
      if (message == null || message.isBlank()) {
        message = "Invalid YAML";
      }
      StructuredLog.fine(LOG, "decode.failed", "message", message);
      return new DecodeResult.Failed(message);
    }
  }
}
