package io.github.pwf.core;

import io.github.pwf.schema.PathSegment;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.StringLength;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Property based checks of the path grammar
class PathResolverPropertyTest {

    @Provide
    Arbitrary<List<PathSegment>> locations() {
        Arbitrary<PathSegment> key = Arbitraries.strings().ofMinLength(0).ofMaxLength(12)
            .withChars("abcXYZ_$-' \\0123.")
            .map(PathSegment.Key::new);
        Arbitrary<PathSegment> index = Arbitraries.integers().between(0, 500).map(PathSegment.Index::new);
        return Arbitraries.oneOf(key, index).list().ofMaxSize(8);
    }

    @Property
    void formattingIsDeterministic(@ForAll("locations") List<PathSegment> location) {
        assertThat(PathResolver.format(location)).isEqualTo(PathResolver.format(List.copyOf(location)));
    }

    @Property
    void formattingIsIncremental(@ForAll("locations") List<PathSegment> location) {
        String expected = "";
        for (PathSegment segment : location) {
            expected = PathResolver.appendSegment(expected, segment);
        }
        assertThat(PathResolver.format(location)).isEqualTo(expected);
    }

    @Property
    void indicesRenderInBrackets(@ForAll @IntRange(min = 0, max = 100_000) int index) {
        assertThat(PathResolver.appendSegment("days", new PathSegment.Index(index)))
            .isEqualTo("days[" + index + "]");
    }

    @Property
    void bracketedKeysUnescapeToOriginal(@ForAll @StringLength(max = 20) String key) {
        String path = PathResolver.appendSegment("", new PathSegment.Key(key));
        if (path.startsWith("['")) {
            assertThat(path).endsWith("']");
            String body = path.substring(2, path.length() - 2);
            assertThat(body.replaceAll("\\\\(.)", "$1")).isEqualTo(key);
        } else {
            assertThat(path).isEqualTo(key);
            assertThat(key).matches("[A-Za-z_$][A-Za-z0-9_$]*");
        }
    }
}
