package com.flamingo.ai.clinicalnotes.service.merge;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.clinicalnotes.domain.enums.ChangeAction;
import com.flamingo.ai.clinicalnotes.domain.enums.MergeStrategy;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.service.merge.SectionSplicer.SpliceResult;
import com.flamingo.ai.clinicalnotes.service.merge.SectionSplicer.SplicedSection;
import com.flamingo.ai.clinicalnotes.service.merge.model.SelectionConfig;
import com.flamingo.ai.clinicalnotes.service.parsing.SectionParser;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import com.flamingo.ai.clinicalnotes.support.TestProfiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SectionSplicer Tests")
class SectionSplicerTest {

  private static final String PREVIOUS =
      """
      HPI:
      Patient reports low mood.

      Psychiatric Exam:
      Flat affect.

      Plan:
      Continue sertraline 50 mg.
      """;

  private final SectionParser parser = new SectionParser(new SimpleMeterRegistry());
  private final SectionSplicer splicer = new SectionSplicer();

  private ParsedNote parse(String text) {
    return parser.parse(text, TestProfiles.credible());
  }

  @Nested
  @DisplayName("splice")
  class Splice {

    @Test
    @DisplayName("should keep the previous instance for sections not selected")
    void shouldPreserveInstance_whenNotSelected() {
      ParsedNote previous = parse(PREVIOUS);
      ParsedNote candidate =
          parse("HPI:\nMood improved.\n\nPsychiatric Exam:\nBright.\n\nPlan:\nIncrease to 100 mg.");
      SelectionConfig selection =
          SelectionConfig.builder().update(SectionType.PLAN, MergeStrategy.REPLACE).build();

      SpliceResult result = splicer.splice(previous, candidate, selection, "openai", false);

      assertThat(result.outputSections().get(0)).isSameAs(previous.sections().get(0));
      assertThat(result.outputSections().get(1)).isSameAs(previous.sections().get(1));
      assertThat(result.outputSections().get(2).content()).isEqualTo("Increase to 100 mg.");
      assertThat(result.sections())
          .extracting(SplicedSection::action)
          .containsExactly(ChangeAction.PRESERVED, ChangeAction.PRESERVED, ChangeAction.UPDATED);
      assertThat(result.sections().get(0).reason()).isEqualTo(SectionSplicer.REASON_NOT_SELECTED);
      assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("should keep the previous heading even when the candidate renames it")
    void shouldKeepPreviousHeading_whenCandidateUsesAlias() {
      ParsedNote previous = parse(PREVIOUS);
      ParsedNote candidate = parse("History of Present Illness:\nMood improved.");
      SelectionConfig selection =
          SelectionConfig.builder().update(SectionType.HPI, MergeStrategy.REPLACE).build();

      SpliceResult result = splicer.splice(previous, candidate, selection, "openai", false);

      assertThat(result.outputSections().get(0).heading()).isEqualTo("HPI:");
      assertThat(result.outputSections().get(0).content()).isEqualTo("Mood improved.");
      assertThat(result.sections().get(0).confidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should discard candidate sections absent from the previous note")
    void shouldDiscardPhantomSections() {
      ParsedNote previous = parse(PREVIOUS);
      ParsedNote candidate =
          parse("Plan:\nIncrease to 100 mg.\n\nSafety Plan:\nCall 988 in crisis.");
      SelectionConfig selection =
          SelectionConfig.builder().update(SectionType.PLAN, MergeStrategy.REPLACE).build();

      SpliceResult result = splicer.splice(previous, candidate, selection, "openai", false);

      assertThat(result.outputSections())
          .extracting(s -> s.type())
          .containsExactly(SectionType.HPI, SectionType.PSYCHIATRIC_EXAM, SectionType.PLAN);
      assertThat(result.warnings())
          .containsExactly("discarded regenerated section SAFETY_PLAN absent from previous note");
    }

    @Test
    @DisplayName("should preserve and flag selected sections the candidate omitted")
    void shouldPreserveOmittedSection() {
      ParsedNote previous = parse(PREVIOUS);
      ParsedNote candidate = parse("HPI:\nMood improved.");
      SelectionConfig selection =
          SelectionConfig.builder()
              .update(SectionType.HPI, MergeStrategy.REPLACE)
              .update(SectionType.PLAN, MergeStrategy.REPLACE)
              .build();

      SpliceResult result = splicer.splice(previous, candidate, selection, "openai", false);

      SplicedSection plan = result.sections().get(2);
      assertThat(plan.omitted()).isTrue();
      assertThat(plan.output()).isSameAs(previous.sections().get(2));
      assertThat(plan.reason()).isEqualTo(SectionSplicer.REASON_OMITTED);
      assertThat(result.omittedCount()).isEqualTo(1);
      assertThat(result.warnings())
          .singleElement()
          .satisfies(
              warning ->
                  assertThat(warning).startsWith("regenerated note omitted selected section PLAN"));
    }

    @Test
    @DisplayName("should match repeated types by occurrence")
    void shouldMatchDuplicatesByOccurrence() {
      ParsedNote previous = parse("Plan:\nFirst.\n\nPlan:\nSecond.");
      ParsedNote candidate = parse("Plan:\nFirst updated.\n\nPlan:\nSecond updated.");
      SelectionConfig selection =
          SelectionConfig.builder().update(SectionType.PLAN, MergeStrategy.REPLACE).build();

      SpliceResult result = splicer.splice(previous, candidate, selection, "openai", false);

      assertThat(result.outputSections())
          .extracting(s -> s.content())
          .containsExactly("First updated.", "Second updated.");
    }

    @Test
    @DisplayName("should name the fallback provider in the ledger reason")
    void shouldNameFallbackProvider() {
      ParsedNote previous = parse(PREVIOUS);
      ParsedNote candidate = parse("Plan:\nIncrease to 100 mg.");
      SelectionConfig selection =
          SelectionConfig.builder().update(SectionType.PLAN, MergeStrategy.REPLACE).build();

      SpliceResult result = splicer.splice(previous, candidate, selection, "gemini", true);

      assertThat(result.sections().get(2).reason())
          .isEqualTo("replaced with regenerated content via fallback provider 'gemini'");
      assertThat(result.sections().get(2).providerId()).isEqualTo("gemini");
    }
  }

  @Nested
  @DisplayName("merge strategies")
  class Strategies {

    @Test
    @DisplayName("should append only the new tail when the candidate repeats previous content")
    void shouldAppendTail() {
      ParsedNote previous = parse("Plan:\nContinue sertraline.");
      ParsedNote candidate = parse("Plan:\nContinue sertraline.\nAdd CBT referral.");
      SelectionConfig selection =
          SelectionConfig.builder().update(SectionType.PLAN, MergeStrategy.APPEND).build();

      SplicedSection plan =
          splicer.splice(previous, candidate, selection, "openai", false).sections().get(0);

      assertThat(plan.generatedPortion()).isEqualTo("Add CBT referral.");
      assertThat(plan.output().content()).isEqualTo("Continue sertraline.\n\nAdd CBT referral.");
      assertThat(plan.action()).isEqualTo(ChangeAction.MERGED);
    }

    @Test
    @DisplayName("should merge only lines not already present")
    void shouldMergeNewLines() {
      ParsedNote previous = parse("Plan:\nContinue sertraline.\nSleep hygiene.");
      ParsedNote candidate = parse("Plan:\nSleep hygiene.\nAdd CBT referral.");
      SelectionConfig selection =
          SelectionConfig.builder().update(SectionType.PLAN, MergeStrategy.MERGE).build();

      SplicedSection plan =
          splicer.splice(previous, candidate, selection, "openai", false).sections().get(0);

      assertThat(plan.output().content())
          .isEqualTo("Continue sertraline.\nSleep hygiene.\nAdd CBT referral.");
      assertThat(plan.reason())
          .isEqualTo("new lines from regenerated content merged into previous content");
    }

    @Test
    @DisplayName("should keep previous content when a merge adds nothing")
    void shouldKeepPrevious_whenMergeAddsNothing() {
      assertThat(splicer.reassemble("Continue.", "", MergeStrategy.MERGE)).isEqualTo("Continue.");
      assertThat(splicer.reassemble("Continue.", "Stop.", MergeStrategy.REPLACE))
          .isEqualTo("Stop.");
    }
  }
}
