package com.flamingo.ai.memoryengine.service.consolidation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.memoryengine.agent.dto.PlannedOperation;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.MemoryOperation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConsolidationPlanValidatorTest {

  private static final Set<String> CANDIDATES = Set.of("m1", "m2", "m3", "m4", "m5", "m6", "m7");

  private MemoryEngineConfig config;
  private ConsolidationPlanValidator validator;

  @BeforeEach
  void setUp() {
    config = new MemoryEngineConfig();
    validator = new ConsolidationPlanValidator(config);
  }

  private static PlannedOperation create(String content) {
    return new PlannedOperation("CREATE", "", content);
  }

  private static PlannedOperation update(String id, String content) {
    return new PlannedOperation("UPDATE", id, content);
  }

  private static PlannedOperation delete(String id) {
    return new PlannedOperation("DELETE", id, "");
  }

  @Nested
  @DisplayName("Delete-ratio safety check")
  class SafetyTests {

    @Test
    @DisplayName("should reject a plan of 10 operations with 7 deletions")
    void shouldRejectDeleteHeavyPlan() {
      List<PlannedOperation> plan = new ArrayList<>();
      for (int i = 1; i <= 7; i++) {
        plan.add(delete("m" + i));
      }
      plan.add(create("I live in Porto"));
      plan.add(create("I speak Portuguese"));
      plan.add(create("I have two sisters"));

      ValidatedPlan result = validator.validate(plan, CANDIDATES);

      assertThat(result.rejected()).isTrue();
      assertThat(result.operations()).isEmpty();
    }

    @Test
    @DisplayName("should accept delete-only plans below the minimum operation count")
    void shouldAcceptSmallDeletePlans() {
      List<PlannedOperation> plan =
          List.of(delete("m1"), delete("m2"), delete("m3"), delete("m4"), delete("m5"));

      ValidatedPlan result = validator.validate(plan, CANDIDATES);

      assertThat(result.rejected()).isFalse();
      assertThat(result.operations()).hasSize(5);
    }

    @Test
    @DisplayName("should accept a plan exactly at the ratio")
    void shouldAcceptPlanAtRatio() {
      config.getConsolidation().setMaxDeleteRatio(0.5);
      List<PlannedOperation> plan =
          List.of(
              delete("m1"),
              delete("m2"),
              delete("m3"),
              create("I live in Porto"),
              create("I speak Portuguese"),
              create("I have two sisters"));

      assertThat(validator.validate(plan, CANDIDATES).rejected()).isFalse();
    }

    @Test
    @DisplayName("should count deletions before dropping invalid operations")
    void shouldCountRawDeletions() {
      List<PlannedOperation> plan =
          List.of(
              delete("x1"),
              delete("x2"),
              delete("x3"),
              delete("x4"),
              delete("x5"),
              create("I live in Porto"));

      assertThat(validator.validate(plan, CANDIDATES).rejected()).isTrue();
    }
  }

  @Nested
  @DisplayName("Operation validation")
  class OperationTests {

    @Test
    @DisplayName("should keep a single CREATE for a new personal fact")
    void shouldKeepSingleCreate() {
      ValidatedPlan result =
          validator.validate(List.of(create("My wife Sarah loves hiking")), Set.of());

      assertThat(result.operations())
          .containsExactly(MemoryOperation.create("My wife Sarah loves hiking"));
    }

    @Test
    @DisplayName("should drop operations on ids that were not shown to the model")
    void shouldDropUnknownIds() {
      ValidatedPlan result =
          validator.validate(
              List.of(update("zz", "I moved to Oslo"), delete("yy"), delete(" m1 ")), CANDIDATES);

      assertThat(result.operations()).containsExactly(MemoryOperation.delete("m1"));
    }

    @Test
    @DisplayName("should drop CREATE and UPDATE with empty content")
    void shouldDropEmptyContent() {
      ValidatedPlan result =
          validator.validate(List.of(create("   "), update("m1", null)), CANDIDATES);

      assertThat(result.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should drop unsupported operation kinds and null entries")
    void shouldDropUnsupportedKinds() {
      ValidatedPlan result =
          validator.validate(
              Arrays.asList(
                  new PlannedOperation("MERGE", "m1", "x"),
                  null,
                  new PlannedOperation(null, "", "I like jazz"),
                  new PlannedOperation("create", "", "I like jazz")),
              CANDIDATES);

      assertThat(result.operations()).containsExactly(MemoryOperation.create("I like jazz"));
    }

    @Test
    @DisplayName("should keep only the first UPDATE per id")
    void shouldDropRepeatedUpdates() {
      ValidatedPlan result =
          validator.validate(
              List.of(update("m1", "I live in Oslo"), update("m1", "I live in Bergen")),
              CANDIDATES);

      assertThat(result.operations())
          .containsExactly(MemoryOperation.update("m1", "I live in Oslo"));
    }

    @Test
    @DisplayName("should drop repeated content regardless of case and padding")
    void shouldDropRepeatedContent() {
      ValidatedPlan result =
          validator.validate(
              List.of(
                  create("I own a bicycle"),
                  create("  i own a BICYCLE "),
                  update("m2", "I own a bicycle")),
              CANDIDATES);

      assertThat(result.operations()).containsExactly(MemoryOperation.create("I own a bicycle"));
    }

    @Test
    @DisplayName("should return an empty plan for no operations")
    void shouldHandleEmptyPlan() {
      ValidatedPlan result = validator.validate(List.of(), CANDIDATES);

      assertThat(result.isEmpty()).isTrue();
      assertThat(result.rejected()).isFalse();
    }
  }

  @Test
  @DisplayName("describe should summarize counts per kind")
  void describeShouldSummarizeCounts() {
    String description =
        ConsolidationPlanValidator.describe(
            List.of(
                MemoryOperation.create("a"),
                MemoryOperation.delete("m1"),
                MemoryOperation.delete("m2")));

    assertThat(description).isEqualTo("1 create, 2 deletes");
  }
}
