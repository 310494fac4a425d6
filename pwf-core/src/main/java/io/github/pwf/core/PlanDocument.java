package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/// A training plan: a cycle of ordered days, each with at least one exercise.
public final class PlanDocument implements Document {

  private final ObjectNode tree;

  PlanDocument(ObjectNode tree) {
    this.tree = Objects.requireNonNull(tree, "tree").deepCopy();
  }

  @Override
  public DocumentKind kind() {
    return DocumentKind.PLAN;
  }

  @Override
  public ObjectNode tree() {
    return tree.deepCopy();
  }

  public int planVersion() {
    return tree.path("plan_version").asInt();
  }

  public Optional<String> title() {
    JsonNode title = tree.path("meta").path("title");
    return title.isTextual() ? Optional.of(title.textValue()) : Optional.empty();
  }

  public int dayCount() {
    return days().size();
  }

  /// Number of exercises in the day at `dayIndex` (0-based)
  public int exerciseCount(int dayIndex) {
    JsonNode day = days().get(dayIndex);
    if (day == null) {
      throw new IndexOutOfBoundsException("No day at index " + dayIndex + " of " + dayCount());
    }
    return day.path("exercises").size();
  }

  private JsonNode days() {
    return tree.path("cycle").path("days");
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PlanDocument other && tree.equals(other.tree);
  }

  @Override
  public int hashCode() {
    return tree.hashCode();
  }

  @Override
  public String toString() {
    return "PlanDocument" + tree;
  }
}
