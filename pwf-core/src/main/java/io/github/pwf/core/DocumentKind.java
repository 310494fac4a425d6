package io.github.pwf.core;

/// The two PWF document kinds. The caller picks the kind; documents are never sniffed.
public enum DocumentKind {
  PLAN("schema/pwf-v1.json", "plan_version"),
  HISTORY("schema/pwf-history-v1.json", "history_version");

  private final String schemaResource;
  private final String versionField;

  DocumentKind(String schemaResource, String versionField) {
    this.schemaResource = schemaResource;
    this.versionField = versionField;
  }

  /// Classpath location of the v1 schema for this kind
  public String schemaResource() {
    return schemaResource;
  }

  /// Top level field carrying the literal format version
  public String versionField() {
    return versionField;
  }
}
