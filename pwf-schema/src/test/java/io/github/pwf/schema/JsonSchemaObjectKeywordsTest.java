package io.github.pwf.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JsonSchemaObjectKeywordsTest extends JsonSchemaTestBase {

    @Test
    void additionalPropertiesFalseReportsAtContainingObject() {
        JsonSchema schema = compile("""
            {
              "type": "object",
              "properties": {"name": {"type": "string"}},
              "additionalProperties": false
            }
            """);

        var result = schema.validate(json("""
            {"name":"Alice","extra": 123}
        """));
        assertThat(result.valid()).isFalse();
        assertThat(result.violations()).hasSize(1);
        Violation violation = result.violations().get(0);
        assertThat(violation.keyword()).isEqualTo("additionalProperties");
        assertThat(violation.location().isRoot()).isTrue();
        assertThat(violation.param(Violation.ADDITIONAL_PROPERTY)).isEqualTo("extra");
    }

    @Test
    void additionalPropertiesSchemaValidatesUnknown() {
        JsonSchema schema = compile("""
            {
              "type": "object",
              "properties": {"id": {"type": "integer"}},
              "additionalProperties": {"type": "string"}
            }
            """);

        // invalid because extra is not a string
        var bad = schema.validate(json("""
            {"id": 1, "extra": 999}
        """));
        assertThat(bad.valid()).isFalse();
        assertThat(bad.violations().get(0).location()).isEqualTo(Location.ROOT.child("extra"));
        assertThat(bad.violations().get(0).message()).contains("Expected string");

        // valid because extra is a string
        var ok = schema.validate(json("""
            {"id": 1, "extra": "note"}
        """));
        assertThat(ok.valid()).isTrue();
    }

    @Test
    void requiredReportsMissingPropertyAsParameter() {
        JsonSchema schema = compile("""
            {
              "type": "object",
              "properties": {
                "inner": {"type": "object", "required": ["exercises"]}
              }
            }
            """);

        var result = schema.validate(json("""
            {"inner": {}}
        """));
        assertThat(result.violations()).singleElement().satisfies(v -> {
            assertThat(v.keyword()).isEqualTo("required");
            assertThat(v.location()).isEqualTo(Location.ROOT.child("inner"));
            assertThat(v.param(Violation.MISSING_PROPERTY)).isEqualTo("exercises");
            assertThat(v.message()).isEqualTo("Missing required property: exercises");
        });
    }

    @Test
    void minAndMaxPropertiesAreEnforced() {
        JsonSchema schema = compile("""
            {
              "type": "object",
              "minProperties": 2,
              "maxProperties": 3
            }
            """);

        var tooFew = schema.validate(json("""
            {"a": 1}
        """));
        assertThat(tooFew.valid()).isFalse();
        assertThat(tooFew.violations().get(0).message()).contains("Too few properties");

        assertThat(schema.validate(json("""
            {"a": 1, "b": 2}
        """)).valid()).isTrue();

        var tooMany = schema.validate(json("""
            {"a":1, "b":2, "c":3, "d":4}
        """));
        assertThat(tooMany.valid()).isFalse();
        assertThat(tooMany.violations().get(0).message()).contains("Too many properties");
    }

    @Test
    void dependentRequiredNamesBothProperties() {
        JsonSchema schema = compile("""
            {
              "type": "object",
              "properties": {
                "target_weight_percent": {"type": "number"},
                "percent_of": {"enum": ["1rm", "3rm"]}
              },
              "dependentRequired": {
                "target_weight_percent": ["percent_of"],
                "percent_of": ["target_weight_percent"]
              }
            }
            """);

        var result = schema.validate(json("""
            {"target_weight_percent": 80}
        """));
        assertThat(result.violations()).singleElement().satisfies(v -> {
            assertThat(v.keyword()).isEqualTo("dependentRequired");
            assertThat(v.param("property")).isEqualTo("target_weight_percent");
            assertThat(v.param(Violation.MISSING_PROPERTY)).isEqualTo("percent_of");
        });

        assertThat(schema.validate(json("""
            {"target_weight_percent": 80, "percent_of": "1rm"}
        """)).valid()).isTrue();
        assertThat(schema.validate(json("{}")).valid()).isTrue();
    }

    @Test
    void patternPropertiesAndPropertyNames() {
        JsonSchema schema = compile("""
            {
              "type": "object",
              "patternProperties": {"^x-": {"type": "string"}},
              "propertyNames": {"maxLength": 5},
              "additionalProperties": false
            }
            """);

        assertThat(schema.validate(json("""
            {"x-a": "ok"}
        """)).valid()).isTrue();

        var wrongType = schema.validate(json("""
            {"x-a": 1}
        """));
        assertThat(wrongType.violations()).singleElement()
            .extracting(Violation::location).isEqualTo(Location.ROOT.child("x-a"));

        var longName = schema.validate(json("""
            {"x-long-name": "v"}
        """));
        assertThat(longName.violations()).extracting(Violation::keyword).containsExactly("propertyNames");
    }

    @Test
    void nonObjectFailsTypeCheck() {
        JsonSchema schema = compile("""
            {"type": "object", "required": ["a"]}
            """);

        var result = schema.validate(json("[1]"));
        assertThat(result.violations()).singleElement().satisfies(v -> {
            assertThat(v.keyword()).isEqualTo("type");
            assertThat(v.params()).containsEntry("type", "object");
        });
    }
}
