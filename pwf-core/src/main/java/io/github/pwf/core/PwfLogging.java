package io.github.pwf.core;

import java.util.logging.Logger;

/// Centralized logger for the PWF core.
/// All classes use this logger via
///   import static io.github.pwf.core.PwfLogging.LOG;
final class PwfLogging {
  public static final Logger LOG = Logger.getLogger("io.github.pwf.core");
  private PwfLogging() {}
}
