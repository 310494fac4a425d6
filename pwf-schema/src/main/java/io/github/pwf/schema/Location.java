package io.github.pwf.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Ordered list of steps from the validated root to a value.
/// The empty list is the root value itself.
public record Location(List<PathSegment> segments) {

  public static final Location ROOT = new Location(List.of());

  public Location {
    Objects.requireNonNull(segments, "segments must not be null");
    segments = List.copyOf(segments);
  }

  public Location child(String name) {
    return append(new PathSegment.Key(name));
  }

  public Location child(int index) {
    return append(new PathSegment.Index(index));
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  private Location append(PathSegment segment) {
    List<PathSegment> next = new ArrayList<>(segments.size() + 1);
    next.addAll(segments);
    next.add(segment);
    return new Location(next);
  }

  /// JSON Pointer rendering, used for diagnostics only
  @Override
  public String toString() {
    if (segments.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (PathSegment segment : segments) {
      sb.append('/').append(segment.toString().replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }
}
