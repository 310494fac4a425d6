package io.github.pwf.schema;

import java.util.logging.Logger;

/// Centralized logger for the schema engine.
/// All classes use this logger via `JsonSchema.LOG` or
///   import static io.github.pwf.schema.SchemaLogging.LOG;
final class SchemaLogging {
  public static final Logger LOG = Logger.getLogger("io.github.pwf.schema");
  private SchemaLogging() {}
}
