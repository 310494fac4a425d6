package io.github.pwf.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/// Value helpers shared by the keyword implementations
final class JsonNodes {

  private JsonNodes() {}

  /// JSON Schema equality: numbers compare by value so that `1` equals `1.0`
  static boolean sameValue(JsonNode a, JsonNode b) {
    if (a.isNumber() && b.isNumber()) {
      if (!isFinite(a) || !isFinite(b)) {
        return a.equals(b);
      }
      return a.decimalValue().compareTo(b.decimalValue()) == 0;
    }
    if (a.isObject() && b.isObject()) {
      if (a.size() != b.size()) return false;
      for (Iterator<String> it = a.fieldNames(); it.hasNext(); ) {
        String name = it.next();
        JsonNode other = b.get(name);
        if (other == null || !sameValue(a.get(name), other)) return false;
      }
      return true;
    }
    if (a.isArray() && b.isArray()) {
      if (a.size() != b.size()) return false;
      for (int i = 0; i < a.size(); i++) {
        if (!sameValue(a.get(i), b.get(i))) return false;
      }
      return true;
    }
    return a.equals(b);
  }

  static boolean isFinite(JsonNode number) {
    if (number.isDouble() || number.isFloat()) {
      return Double.isFinite(number.doubleValue());
    }
    return true;
  }

  /// Canonicalization helper for structural equality in uniqueItems
  static String canonicalize(JsonNode v) {
    if (v.isObject()) {
      List<String> keys = new ArrayList<>();
      v.fieldNames().forEachRemaining(keys::add);
      Collections.sort(keys);
      StringBuilder sb = new StringBuilder("{");
      for (int i = 0; i < keys.size(); i++) {
        String k = keys.get(i);
        if (i > 0) sb.append(',');
        sb.append('"').append(escapeJsonString(k)).append("\":").append(canonicalize(v.get(k)));
      }
      return sb.append('}').toString();
    }
    if (v.isArray()) {
      StringBuilder sb = new StringBuilder("[");
      for (int i = 0; i < v.size(); i++) {
        if (i > 0) sb.append(',');
        sb.append(canonicalize(v.get(i)));
      }
      return sb.append(']').toString();
    }
    if (v.isTextual()) {
      return "\"" + escapeJsonString(v.textValue()) + "\"";
    }
    if (v.isNumber() && isFinite(v)) {
      return v.decimalValue().stripTrailingZeros().toPlainString();
    }
    return v.toString();
  }

  static String escapeJsonString(String s) {
    StringBuilder result = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      switch (ch) {
        case '"':
          result.append("\\\"");
          break;
        case '\\':
          result.append("\\\\");
          break;
        case '\n':
          result.append("\\n");
          break;
        case '\r':
          result.append("\\r");
          break;
        case '\t':
          result.append("\\t");
          break;
        default:
          if (ch < 0x20 || ch > 0x7e) {
            result.append("\\u").append(String.format("%04x", (int) ch));
          } else {
            result.append(ch);
          }
      }
    }
    return result.toString();
  }
}
