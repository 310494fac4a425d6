package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.pwf.schema.JsonSchema;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import static io.github.pwf.core.PwfLogging.LOG;

/// Compiled schemas, one per `DocumentKind`.
///
/// Schemas are classpath resources compiled once on first use with format assertion
/// enabled. The compiled schemas are immutable and shared by all callers.
public final class SchemaRegistry {

  private SchemaRegistry() {}

  /// Initialization-on-demand holder: the JVM guarantees a single, safely published load
  private static final class Holder {
    static final Map<DocumentKind, JsonSchema> SCHEMAS = loadAll();
  }

  public static JsonSchema schemaFor(DocumentKind kind) {
    Objects.requireNonNull(kind, "kind");
    return Holder.SCHEMAS.get(kind);
  }

  private static Map<DocumentKind, JsonSchema> loadAll() {
    ObjectMapper mapper = new ObjectMapper();
    Map<DocumentKind, JsonSchema> schemas = new EnumMap<>(DocumentKind.class);
    for (DocumentKind kind : DocumentKind.values()) {
      schemas.put(kind, load(mapper, kind));
    }
    return schemas;
  }

  static JsonSchema load(ObjectMapper mapper, DocumentKind kind) {
    String resource = kind.schemaResource();
    try (InputStream in = SchemaRegistry.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Schema resource not found on classpath: " + resource);
      }
      JsonNode schemaJson = mapper.readTree(in);
      JsonSchema schema = JsonSchema.compile(schemaJson, JsonSchema.JsonSchemaOptions.STRICT_FORMATS);
      StructuredLog.fine(LOG, "schema.loaded", "kind", kind, "resource", resource);
      return schema;
    } catch (IOException | IllegalArgumentException e) {
      StructuredLog.severe(LOG, "schema.load.failed", e, "kind", kind, "resource", resource);
      throw new IllegalStateException("Failed to load schema " + resource + ": " + e.getMessage(), e);
    }
  }
}
