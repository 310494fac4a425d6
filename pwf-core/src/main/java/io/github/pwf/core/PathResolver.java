package io.github.pwf.core;

import io.github.pwf.schema.PathSegment;
import io.github.pwf.schema.Violation;

import java.util.List;
import java.util.regex.Pattern;

/// Renders violation locations as canonical path strings.
///
/// Grammar, applied left to right from an empty string:
/// - array index `N` appends `[N]`
/// - a key matching `^[A-Za-z_$][A-Za-z0-9_$]*$` appends `.key`, without the dot at the start
/// - any other key appends `['key']` with `\` and `'` escaped by a backslash
///
/// So a missing `exercises` in the first day reads `cycle.days[0].exercises` and an
/// unexpected `foo-bar` at the root reads `['foo-bar']`.
public final class PathResolver {

  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");

  private PathResolver() {}

  /// Path of a violation. For `required` and `additionalProperties` the named property
  /// is appended to the location of the containing object.
  public static String resolve(Violation violation) {
    String path = format(violation.location().segments());
    String trailing = switch (violation.keyword()) {
      case "required" -> violation.param(Violation.MISSING_PROPERTY);
      case "additionalProperties" -> violation.param(Violation.ADDITIONAL_PROPERTY);
      default -> null;
    };
    return trailing == null ? path : appendSegment(path, new PathSegment.Key(trailing));
  }

  public static String format(List<PathSegment> segments) {
    String path = "";
    for (PathSegment segment : segments) {
      path = appendSegment(path, segment);
    }
    return path;
  }

  public static String appendSegment(String path, PathSegment segment) {
    if (segment instanceof PathSegment.Index index) {
      return path + "[" + index.index() + "]";
    }
    String key = ((PathSegment.Key) segment).name();
    if (IDENTIFIER.matcher(key).matches()) {
      return path.isEmpty() ? key : path + "." + key;
    }
    return path + "['" + escape(key) + "']";
  }

  private static String escape(String key) {
    StringBuilder sb = new StringBuilder(key.length() + 4);
    for (int i = 0; i < key.length(); i++) {
      char ch = key.charAt(i);
      if (ch == '\\' || ch == '\'') {
        sb.append('\\');
      }
      sb.append(ch);
    }
    return sb.toString();
  }
}
