package io.github.pwf.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Objects;

import static io.github.pwf.core.PwfLogging.LOG;

/// Fluent construction of plan documents.
///
/// ```java
/// PlanDocument plan = new PlanBuilder()
///     .meta(Map.of("title", "Starter Strength"))
///     .addDay("Lower")
///     .addExercise("Squat", Modality.STRENGTH, Map.of("target_sets", 3, "target_reps", 5))
///     .build();
/// ```
///
/// `build()` enforces that the plan has at least one day and that every day has at least
/// one exercise. It does not run the schema; use `Pwf.validatePlan(plan)` for that.
/// A builder is owned by one caller and is not thread-safe.
public final class PlanBuilder {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final PlanDraft draft = new PlanDraft();
  private Cursor cursor = new Cursor.Empty();

  /// Which day `addExercise` appends to
  private sealed interface Cursor {
    record Empty() implements Cursor {}
    record HasCurrentDay(int index) implements Cursor {}
  }

  public PlanBuilder version(int version) {
    draft.planVersion = version;
    return this;
  }

  public PlanBuilder meta(ObjectNode meta) {
    draft.meta = meta == null ? null : meta.deepCopy();
    return this;
  }

  public PlanBuilder meta(Map<String, ?> meta) {
    draft.meta = meta == null ? null : toObject(meta);
    return this;
  }

  public PlanBuilder glossary(Map<String, String> glossary) {
    draft.glossary = PlanDraft.copyOf(glossary);
    return this;
  }

  public PlanBuilder addDay() {
    return addDay(null, Map.of());
  }

  public PlanBuilder addDay(String focus) {
    return addDay(focus, Map.of());
  }

  /// Appends a day and makes it current. `overrides` may set any day field, including an
  /// initial `exercises` list; a null or empty focus is left out.
  public PlanBuilder addDay(String focus, Map<String, ?> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    ObjectNode fields = MAPPER.createObjectNode();
    if (focus != null && !focus.isEmpty()) {
      fields.put("focus", focus);
    }
    fields.setAll(toObject(overrides));
    JsonNode initial = fields.remove("exercises");

    PlanDraft.DraftDay day = new PlanDraft.DraftDay(fields);
    if (initial != null && initial.isArray()) {
      for (JsonNode exercise : initial) {
        if (!exercise.isObject()) {
          throw new IllegalArgumentException("Day exercises must be mappings, got " + exercise.getNodeType());
        }
        day.exercises.add(((ObjectNode) exercise).deepCopy());
      }
    } else if (initial != null && !initial.isNull()) {
      throw new IllegalArgumentException("Day exercises must be a list, got " + initial.getNodeType());
    }
    draft.days.add(day);
    cursor = new Cursor.HasCurrentDay(draft.days.size() - 1);
    StructuredLog.finer(LOG, "plan.addDay", "index", draft.days.size() - 1, "focus", focus);
    return this;
  }

  public PlanBuilder addExercise(String name, Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    return append(name, toObject(fields));
  }

  public PlanBuilder addExercise(String name, Modality modality, Map<String, ?> fields) {
    Objects.requireNonNull(modality, "modality");
    Objects.requireNonNull(fields, "fields");
    ObjectNode exercise = MAPPER.createObjectNode();
    exercise.put("modality", modality.wireName());
    exercise.setAll(toObject(fields));
    return append(name, exercise);
  }

  private PlanBuilder append(String name, ObjectNode fields) {
    PlanDraft.DraftDay day = currentDay();
    // name first, and a name in fields does not replace it
    ObjectNode exercise = MAPPER.createObjectNode();
    exercise.put("name", name);
    fields.fields().forEachRemaining(e -> {
      if (!"name".equals(e.getKey())) {
        exercise.set(e.getKey(), e.getValue());
      }
    });
    day.exercises.add(exercise);
    StructuredLog.finer(LOG, "plan.addExercise", "name", name, "count", day.exercises.size());
    return this;
  }

  private PlanDraft.DraftDay currentDay() {
    if (cursor instanceof Cursor.HasCurrentDay current && current.index() < draft.days.size()) {
      return draft.days.get(current.index());
    }
    throw new IllegalStateException("addExercise requires an active day. Call addDay first.");
  }

  /// Snapshot of the plan. Calling it again, or mutating the builder afterwards,
  /// does not affect earlier snapshots.
  /// @throws IllegalStateException when there are no days or a day has no exercises
  public PlanDocument build() {
    if (draft.days.isEmpty()) {
      throw new IllegalStateException("Plan requires at least one day.");
    }
    for (int i = 0; i < draft.days.size(); i++) {
      if (draft.days.get(i).exercises.isEmpty()) {
        throw new IllegalStateException("Day " + (i + 1) + " requires at least one exercise.");
      }
    }
    PlanDocument document = new PlanDocument(draft.toTree());
    StructuredLog.fine(LOG, "plan.build", "days", document.dayCount());
    return document;
  }

  public String toYaml() {
    return Serializer.encode(build());
  }

  private static ObjectNode toObject(Map<String, ?> values) {
    return MAPPER.valueToTree(values);
  }
}
