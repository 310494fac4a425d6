package io.github.pwf.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ConverterRegistryTest extends PwfTestBase {

    /// Stands in for the external engine: echoes its input as the converted document
    private static final FormatConverter ECHO = (input, summaryOnly) -> new ConversionResult.Converted(
        new String(input, StandardCharsets.UTF_8),
        summaryOnly ? List.of(ConversionWarning.timeSeriesSkipped("summary only")) : List.of());

    private static final FormatConverter BROKEN = (input, summaryOnly) ->
        new ConversionResult.Failed("Failed to read FIT file: truncated header");

    @Test
    void unregisteredFormatFails() {
        ConverterRegistry registry = ConverterRegistry.builder().register(SourceFormat.TCX, ECHO).build();

        ConversionResult result = registry.convert(SourceFormat.FIT, new byte[] {1, 2, 3}, false);

        assertThat(registry.supports(SourceFormat.FIT)).isFalse();
        assertThat(result).isInstanceOf(ConversionResult.Failed.class);
        assertThat(((ConversionResult.Failed) result).error()).isEqualTo("Unsupported format: fit");
    }

    @Test
    void registeredConverterIsUsed() {
        ConverterRegistry registry = ConverterRegistry.builder().register(SourceFormat.GPX, ECHO).build();

        ConversionResult result = registry.convert(SourceFormat.GPX, "a: 1".getBytes(StandardCharsets.UTF_8), true);

        assertThat(registry.supportedFormats()).containsExactly(SourceFormat.GPX);
        assertThat(result).isInstanceOfSatisfying(ConversionResult.Converted.class, converted -> {
            assertThat(converted.pwfYaml()).isEqualTo("a: 1");
            assertThat(converted.warnings()).extracting(ConversionWarning::type)
                .containsExactly(ConversionWarning.Type.TIME_SERIES_SKIPPED);
        });
    }

    @Test
    void emptyRegistrySupportsNothing() {
        assertThat(ConverterRegistry.empty().supportedFormats()).isEmpty();
    }

    @Test
    void importHistoryParsesConvertedText() {
        byte[] input = fixture("history-minimal.yaml").getBytes(StandardCharsets.UTF_8);
        FormatConverter withWarning = (bytes, summaryOnly) -> new ConversionResult.Converted(
            new String(bytes, StandardCharsets.UTF_8),
            List.of(ConversionWarning.missingField("left_right_balance", "no PWF equivalent")));

        HistoryImport imported = Pwf.importHistory(withWarning, input);

        assertThat(imported.result().orElseThrow().workoutCount()).isEqualTo(1);
        assertThat(imported.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.field()).isEqualTo("left_right_balance");
            assertThat(warning.message()).isEqualTo("Missing field 'left_right_balance': no PWF equivalent");
        });
    }

    @Test
    void importHistoryReportsConversionFailureAsRootIssue() {
        HistoryImport imported = Pwf.importHistory(BROKEN, new byte[0]);

        assertThat(imported.warnings()).isEmpty();
        assertThat(imported.result().issues()).singleElement().satisfies(issue -> {
            assertThat(issue.path()).isEmpty();
            assertThat(issue.message()).contains("truncated header");
        });
    }

    @Test
    void importHistoryValidatesConvertedText() {
        ConverterRegistry registry = ConverterRegistry.builder().register(SourceFormat.CSV, ECHO).build();
        byte[] input = "history_version: 1\nworkouts: []\n".getBytes(StandardCharsets.UTF_8);

        HistoryImport imported = Pwf.importHistory(registry.converterFor(SourceFormat.CSV), input);

        assertThat(imported.result().issues()).extracting(ValidationIssue::path).containsExactly("exported_at");
    }

    @Test
    void throwingConverterBecomesRootIssue() {
        FormatConverter throwing = (bytes, summaryOnly) -> {
            throw new IllegalArgumentException("unexpected record type 0x7f");
        };

        HistoryImport imported = Pwf.importHistory(throwing, new byte[] {0x7f});

        assertThat(imported.warnings()).isEmpty();
        assertThat(imported.result().issues()).singleElement().satisfies(issue -> {
            assertThat(issue.path()).isEmpty();
            assertThat(issue.message()).isEqualTo("Conversion failed: unexpected record type 0x7f");
        });
    }

    @Test
    void missingConverterResultBecomesRootIssue() {
        FormatConverter silent = (bytes, summaryOnly) -> null;

        HistoryImport imported = Pwf.importHistory(silent, new byte[0]);

        assertThat(imported.result().issues()).singleElement()
            .satisfies(issue -> assertThat(issue.message()).contains("no result"));
    }

    @Test
    void registryReportsThrowingConverterAsFailed() {
        ConverterRegistry registry = ConverterRegistry.builder()
            .register(SourceFormat.FIT, (bytes, summaryOnly) -> {
                throw new IllegalStateException();
            })
            .build();

        assertThat(registry.convert(SourceFormat.FIT, new byte[0], false))
            .isInstanceOfSatisfying(ConversionResult.Failed.class,
                failed -> assertThat(failed.error()).isEqualTo("Conversion failed: IllegalStateException"));
    }

    @Test
    void warningFactoriesCarryTypeAndField() {
        assertThat(List.of(
            ConversionWarning.valueClamped("rpe", "12", "10"),
            ConversionWarning.unsupportedFeature("developer fields"),
            ConversionWarning.dataQualityIssue("heart rate dropout")))
            .extracting(ConversionWarning::type, ConversionWarning::field, ConversionWarning::message)
            .containsExactly(
                tuple(ConversionWarning.Type.VALUE_CLAMPED, "rpe", "Value clamped in 'rpe': 12 -> 10"),
                tuple(ConversionWarning.Type.UNSUPPORTED_FEATURE, null, "Unsupported feature: developer fields"),
                tuple(ConversionWarning.Type.DATA_QUALITY_ISSUE, null, "Data quality issue: heart rate dropout"));
    }

    @Test
    void sourceFormatFromFileName() {
        assertThat(SourceFormat.fromFileName("ride.FIT")).contains(SourceFormat.FIT);
        assertThat(SourceFormat.fromFileName("export.tcx")).contains(SourceFormat.TCX);
        assertThat(SourceFormat.fromFileName("notes.txt")).isEmpty();
        assertThat(SourceFormat.fromFileName("README")).isEmpty();
    }
}
