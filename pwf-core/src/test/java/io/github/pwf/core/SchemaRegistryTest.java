package io.github.pwf.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.pwf.schema.JsonSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaRegistryTest extends PwfTestBase {

    @ParameterizedTest
    @EnumSource(DocumentKind.class)
    void schemaIsCompiledOnce(DocumentKind kind) {
        JsonSchema first = SchemaRegistry.schemaFor(kind);

        assertThat(first).isNotNull();
        assertThat(SchemaRegistry.schemaFor(kind)).isSameAs(first);
    }

    @ParameterizedTest
    @EnumSource(DocumentKind.class)
    void resourceCompilesFresh(DocumentKind kind) {
        assertThat(SchemaRegistry.load(new ObjectMapper(), kind)).isNotNull();
    }

    @Test
    void kindsHaveDistinctSchemas() {
        assertThat(SchemaRegistry.schemaFor(DocumentKind.PLAN))
            .isNotSameAs(SchemaRegistry.schemaFor(DocumentKind.HISTORY));
        assertThat(DocumentKind.PLAN.versionField()).isEqualTo("plan_version");
        assertThat(DocumentKind.HISTORY.versionField()).isEqualTo("history_version");
    }

    @Test
    void severityRendersLowercase() {
        assertThat(Severity.ERROR.label()).isEqualTo("error");
        assertThat(Severity.WARNING.toString()).isEqualTo("warning");
        assertThat(ValidationIssue.error("cycle", "Missing").toString()).isEqualTo("error cycle: Missing");
    }
}
