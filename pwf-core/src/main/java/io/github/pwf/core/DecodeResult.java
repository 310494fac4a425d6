package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/// Outcome of decoding document text: a value tree or the decoder's message.
public sealed interface DecodeResult permits DecodeResult.Decoded, DecodeResult.Failed {

  record Decoded(JsonNode value) implements DecodeResult {
    public Decoded {
      Objects.requireNonNull(value, "value");
    }
  }

  record Failed(String message) implements DecodeResult {
    public Failed {
      Objects.requireNonNull(message, "message");
    }
  }
}
