package io.github.pwf.core;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Mutable shadow of a plan while it is being built.
/// The day list and every day's exercise list are always present, possibly empty.
final class PlanDraft {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  int planVersion = 1;
  ObjectNode meta;
  Map<String, String> glossary;
  final List<DraftDay> days = new ArrayList<>();

  /// A day under construction: its own fields plus the exercises added so far
  static final class DraftDay {
    final ObjectNode fields;
    final List<ObjectNode> exercises = new ArrayList<>();

    DraftDay(ObjectNode fields) {
      this.fields = fields;
    }
  }

  ObjectNode toTree() {
    ObjectNode root = NODES.objectNode();
    root.put("plan_version", planVersion);
    if (meta != null) {
      root.set("meta", meta.deepCopy());
    }
    if (glossary != null) {
      ObjectNode terms = root.putObject("glossary");
      glossary.forEach(terms::put);
    }
    ArrayNode dayNodes = root.putObject("cycle").putArray("days");
    for (DraftDay day : days) {
      ObjectNode dayNode = day.fields.deepCopy();
      ArrayNode exerciseNodes = dayNode.putArray("exercises");
      day.exercises.forEach(exercise -> exerciseNodes.add(exercise.deepCopy()));
      dayNodes.add(dayNode);
    }
    return root;
  }

  static Map<String, String> copyOf(Map<String, String> glossary) {
    return glossary == null ? null : new LinkedHashMap<>(glossary);
  }
}
