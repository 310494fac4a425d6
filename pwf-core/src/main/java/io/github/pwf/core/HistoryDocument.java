package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.OffsetDateTime;
import java.util.Objects;

/// A workout history export: completed workouts with optional records and measurements.
public final class HistoryDocument implements Document {

  private final ObjectNode tree;

  HistoryDocument(ObjectNode tree) {
    this.tree = Objects.requireNonNull(tree, "tree").deepCopy();
  }

  @Override
  public DocumentKind kind() {
    return DocumentKind.HISTORY;
  }

  @Override
  public ObjectNode tree() {
    return tree.deepCopy();
  }

  public int historyVersion() {
    return tree.path("history_version").asInt();
  }

  /// Export timestamp; the schema guarantees an RFC 3339 date-time with offset
  public OffsetDateTime exportedAt() {
    return OffsetDateTime.parse(tree.path("exported_at").asText());
  }

  public int workoutCount() {
    return tree.path("workouts").size();
  }

  /// Total number of completed sets over all workouts
  public int setCount() {
    int sets = 0;
    for (JsonNode workout : tree.path("workouts")) {
      for (JsonNode exercise : workout.path("exercises")) {
        sets += exercise.path("sets").size();
      }
    }
    return sets;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof HistoryDocument other && tree.equals(other.tree);
  }

  @Override
  public int hashCode() {
    return tree.hashCode();
  }

  @Override
  public String toString() {
    return "HistoryDocument" + tree;
  }
}
