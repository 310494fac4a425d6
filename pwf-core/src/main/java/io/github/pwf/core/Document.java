package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/// A schema-valid PWF document.
///
/// Documents own a private copy of their tree and hand out copies, so a document
/// never changes after construction. Equality is structural over the tree.
/// Serialization is `Serializer.encode(document)`.
public sealed interface Document permits PlanDocument, HistoryDocument {

  DocumentKind kind();

  /// Fresh deep copy of the document tree
  ObjectNode tree();

  /// Wraps an already validated tree as the document type of `kind`
  static Document of(DocumentKind kind, JsonNode tree) {
    Objects.requireNonNull(kind, "kind");
    if (tree == null || !tree.isObject()) {
      throw new IllegalArgumentException("A PWF document must be a mapping at the top level");
    }
    ObjectNode object = (ObjectNode) tree;
    return switch (kind) {
      case PLAN -> new PlanDocument(object);
      case HISTORY -> new HistoryDocument(object);
    };
  }
}
