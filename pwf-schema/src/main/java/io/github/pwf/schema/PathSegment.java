package io.github.pwf.schema;

import java.util.Objects;

/// A single step in a violation location.
///
/// Locations are expressed relative to the JSON value passed to `JsonSchema.validate(...)`.
public sealed interface PathSegment permits PathSegment.Key, PathSegment.Index {

    /// Object member step (by property name).
    record Key(String name) implements PathSegment {
        public Key {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /// Array element step (by index).
    record Index(int index) implements PathSegment {
        public Index {
            if (index < 0) {
                throw new IllegalArgumentException("index must be >= 0: " + index);
            }
        }

        @Override
        public String toString() {
            return Integer.toString(index);
        }
    }
}
