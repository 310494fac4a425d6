package io.github.pwf.core;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanBuilderTest extends PwfTestBase {

    @Test
    void buildWithoutDaysFails() {
        assertThatThrownBy(() -> new PlanBuilder().build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("at least one day");
    }

    @Test
    void buildWithEmptyDayFailsNamingTheDay() {
        assertThatThrownBy(() -> new PlanBuilder().addDay().build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("at least one exercise")
            .hasMessageContaining("Day 1");
    }

    @Test
    void firstEmptyDayIsReportedOneIndexed() {
        PlanBuilder builder = new PlanBuilder()
            .addDay("A").addExercise("Squat", Map.of("modality", "strength"))
            .addDay("B")
            .addDay("C");

        assertThatThrownBy(builder::build).hasMessage("Day 2 requires at least one exercise.");
    }

    @Test
    void addExerciseBeforeAddDayFails() {
        assertThatThrownBy(() -> new PlanBuilder().addExercise("Squat", Map.of("modality", "strength")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("requires an active day");
    }

    @Test
    void builtPlanSerializesVersionAndQuotedName() {
        String text = Serializer.encode(new PlanBuilder()
            .version(1)
            .addDay("D")
            .addExercise("E", Map.of("modality", "strength", "target_sets", 3, "target_reps", 5))
            .build());

        assertThat(text).contains("plan_version: 1").contains("\"E\"");
    }

    @Test
    void builtPlanIsSchemaValid() {
        PlanDocument plan = new PlanBuilder()
            .meta(Map.of("title", "Starter Strength"))
            .glossary(Map.of("AMRAP", "As many reps as possible"))
            .addDay("Lower")
            .addExercise("Squat", Modality.STRENGTH, Map.of("target_sets", 3, "target_reps", 5))
            .addExercise("Plank", Modality.COUNTDOWN, Map.of("target_duration_sec", 60))
            .addDay("Upper", Map.of("order", 1))
            .addExercise("Bench Press", Modality.STRENGTH, Map.of("target_weight_percent", 70, "percent_of", "1rm"))
            .build();

        assertThat(Pwf.validatePlan(plan)).isEmpty();
        assertThat(plan.dayCount()).isEqualTo(2);
        assertThat(plan.exerciseCount(0)).isEqualTo(2);
        assertThat(plan.title()).contains("Starter Strength");
    }

    @Test
    void builderDoesNotSchemaValidate() {
        PlanDocument plan = new PlanBuilder()
            .version(2)
            .addDay()
            .addExercise("Yoga Flow", Map.of("modality", "yoga"))
            .build();

        assertThat(Pwf.validatePlan(plan)).extracting(ValidationIssue::path)
            .containsExactly("plan_version", "cycle.days[0].exercises[0].modality");
    }

    @Test
    void dayLayoutMatchesDocumentShape() {
        ObjectNode tree = new PlanBuilder()
            .addDay("Lower", Map.of("notes", "Heavy"))
            .addExercise("Squat", Modality.STRENGTH, Map.of())
            .build()
            .tree();

        assertThat(tree).isEqualTo(json("""
            {
              "plan_version": 1,
              "cycle": {
                "days": [
                  {"focus": "Lower", "notes": "Heavy", "exercises": [{"name": "Squat", "modality": "strength"}]}
                ]
              }
            }
            """));
    }

    @Test
    void nullOrEmptyFocusIsOmitted() {
        ObjectNode tree = new PlanBuilder()
            .addDay(null)
            .addExercise("Squat", Modality.STRENGTH, Map.of())
            .addDay("")
            .addExercise("Bench", Modality.STRENGTH, Map.of())
            .build()
            .tree();

        assertThat(tree.path("cycle").path("days").path(0).has("focus")).isFalse();
        assertThat(tree.path("cycle").path("days").path(1).has("focus")).isFalse();
    }

    @Test
    void overridesMaySupplyExercises() {
        PlanDocument plan = new PlanBuilder()
            .addDay("Prebuilt", Map.of("exercises", List.of(Map.of("name", "Row", "modality", "rowing"))))
            .build();

        assertThat(plan.exerciseCount(0)).isEqualTo(1);
        assertThat(Pwf.validatePlan(plan)).isEmpty();
    }

    @Test
    void exerciseFieldsCannotReplaceName() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", "Other");
        fields.put("modality", "strength");

        ObjectNode tree = new PlanBuilder().addDay().addExercise("Squat", fields).build().tree();

        assertThat(tree.path("cycle").path("days").path(0).path("exercises").path(0).path("name").asText())
            .isEqualTo("Squat");
    }

    @Test
    void exercisesGoToTheMostRecentDay() {
        PlanDocument plan = new PlanBuilder()
            .addDay("A").addExercise("One", Modality.STRENGTH, Map.of())
            .addDay("B").addExercise("Two", Modality.STRENGTH, Map.of()).addExercise("Three", Modality.STRENGTH, Map.of())
            .build();

        assertThat(plan.exerciseCount(0)).isEqualTo(1);
        assertThat(plan.exerciseCount(1)).isEqualTo(2);
    }

    @Test
    void buildIsIdempotentAndSnapshotsAreIsolated() {
        PlanBuilder builder = new PlanBuilder()
            .addDay("A")
            .addExercise("Squat", Modality.STRENGTH, Map.of());

        PlanDocument first = builder.build();
        PlanDocument second = builder.build();
        assertThat(second).isEqualTo(first);

        builder.addExercise("Lunge", Modality.STRENGTH, Map.of()).addDay("B").addExercise("Row", Modality.ROWING, Map.of());

        assertThat(first.dayCount()).isEqualTo(1);
        assertThat(first.exerciseCount(0)).isEqualTo(1);
        assertThat(builder.build().dayCount()).isEqualTo(2);
    }

    @Test
    void inputsAreCopiedNotAliased() {
        Map<String, String> glossary = new LinkedHashMap<>();
        glossary.put("RPE", "Rate of perceived exertion");
        ObjectNode meta = MAPPER.createObjectNode().put("title", "Plan");

        PlanBuilder builder = new PlanBuilder().meta(meta).glossary(glossary)
            .addDay().addExercise("Squat", Modality.STRENGTH, Map.of());
        glossary.put("1RM", "One rep max");
        meta.put("title", "Changed");

        ObjectNode tree = builder.build().tree();
        assertThat(tree.path("glossary").size()).isEqualTo(1);
        assertThat(tree.path("meta").path("title").asText()).isEqualTo("Plan");
    }

    @Test
    void toYamlRoundTripsThroughParse() {
        PlanBuilder builder = new PlanBuilder()
            .meta(Map.of("title", "Round Trip"))
            .addDay("Ride")
            .addExercise("Tempo", Modality.CYCLING, Map.of(
                "target_duration_sec", 2400,
                "zones", List.of(Map.of("zone", 3, "duration_sec", 2400))));

        PlanDocument parsed = Pwf.parsePlan(builder.toYaml()).orElseThrow();

        assertThat(parsed).isEqualTo(builder.build());
    }

    @Test
    void modalityWireNames() {
        assertThat(Modality.STRENGTH.wireName()).isEqualTo("strength");
        assertThat(Modality.fromWireName("swimming")).contains(Modality.SWIMMING);
        assertThat(Modality.fromWireName("yoga")).isEmpty();
    }
}
