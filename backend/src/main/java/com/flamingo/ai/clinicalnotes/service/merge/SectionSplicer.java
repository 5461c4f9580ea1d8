package com.flamingo.ai.clinicalnotes.service.merge;

import com.flamingo.ai.clinicalnotes.domain.enums.ChangeAction;
import com.flamingo.ai.clinicalnotes.domain.enums.MergeStrategy;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.service.merge.model.SectionSelection;
import com.flamingo.ai.clinicalnotes.service.merge.model.SelectionConfig;
import com.flamingo.ai.clinicalnotes.service.parsing.PlaceholderSyntax;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import com.flamingo.ai.clinicalnotes.service.parsing.model.Section;
import com.flamingo.ai.clinicalnotes.service.parsing.model.SectionMetadata;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assembles the final sections of a merge from the previous note and a re-parsed candidate.
 *
 * <p>The output always has the previous note's type sequence. Sections not selected for update are
 * the previous {@link Section} instances themselves; their content is never read from the
 * candidate. Candidate sections without a counterpart in the previous note are discarded.
 */
@Component
@Slf4j
public class SectionSplicer {

  static final String REASON_NOT_SELECTED = "not selected for update; previous content preserved";
  static final String REASON_OMITTED =
      "selected for update but regenerated note omitted this section; previous content preserved";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Splices candidate content into the previous note.
   *
   * @param previous the parsed previous note
   * @param candidate the parsed, cleaned generator output
   * @param selection per-type update choices
   * @param providerId provider that produced the candidate
   * @param fallbackUsed whether that provider was the fallback
   */
  public SpliceResult splice(
      ParsedNote previous,
      ParsedNote candidate,
      SelectionConfig selection,
      String providerId,
      boolean fallbackUsed) {

    Map<String, List<Section>> candidatesByKey = new LinkedHashMap<>();
    for (Section section : candidate.sections()) {
      candidatesByKey.computeIfAbsent(matchKey(section), k -> new ArrayList<>()).add(section);
    }

    Map<String, Integer> occurrences = new HashMap<>();
    Set<Section> consumed = Collections.newSetFromMap(new IdentityHashMap<>());
    List<SplicedSection> spliced = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    for (Section prev : previous.sections()) {
      String key = matchKey(prev);
      int occurrence = occurrences.merge(key, 1, Integer::sum) - 1;
      SectionSelection choice = selection.forType(prev.type());

      if (!choice.shouldUpdate()) {
        spliced.add(SplicedSection.preserved(prev, REASON_NOT_SELECTED));
        continue;
      }

      List<Section> matches = candidatesByKey.getOrDefault(key, List.of());
      Section match = occurrence < matches.size() ? matches.get(occurrence) : null;
      if (match != null) {
        consumed.add(match);
      }
      if (match == null || match.content().isBlank()) {
        warnings.add(
            "regenerated note omitted selected section "
                + prev.type()
                + describeHeading(prev)
                + "; previous content preserved");
        spliced.add(SplicedSection.omitted(prev, REASON_OMITTED));
        continue;
      }

      MergeStrategy strategy = choice.mergeStrategy();
      String portion = generatedPortion(prev.content(), match.content(), strategy);
      spliced.add(
          new SplicedSection(
              prev,
              withContent(prev, reassemble(prev.content(), portion, strategy)),
              actionFor(strategy),
              strategy,
              portion,
              reasonFor(strategy, providerId, fallbackUsed),
              match.confidence(),
              providerId,
              false));
    }

    Set<SectionType> previousTypes = previous.sectionTypes();
    for (Section section : candidate.sections()) {
      if (consumed.contains(section)) {
        continue;
      }
      if (!previousTypes.contains(section.type())) {
        log.info(
            "Discarding candidate section {} ('{}') absent from the previous note",
            section.type(),
            section.heading());
        warnings.add(
            "discarded regenerated section " + section.type() + " absent from previous note");
      } else {
        log.debug("Ignoring unused candidate section {} ('{}')", section.type(), section.heading());
      }
    }

    return new SpliceResult(spliced, warnings);
  }

  /**
   * Rebuilds a section's content from the previous content and the generator-sourced portion.
   * {@code REPLACE} uses the portion alone; {@code APPEND} separates the two with a blank line and
   * {@code MERGE} with a line break.
   */
  public String reassemble(String previous, String portion, MergeStrategy strategy) {
    if (strategy == MergeStrategy.REPLACE) {
      return portion;
    }
    if (portion == null || portion.isBlank()) {
      return previous;
    }
    if (previous == null || previous.isBlank()) {
      return portion;
    }
    String separator = strategy == MergeStrategy.APPEND ? "\n\n" : "\n";
    return previous + separator + portion;
  }

  /** Replaces a section's content, keeping its heading, type and position. */
  public Section withContent(Section prev, String content) {
    SectionMetadata metadata =
        new SectionMetadata(
            prev.heading(),
            wordCount(content),
            prev.metadata() != null && prev.metadata().standardized(),
            PlaceholderSyntax.containsPlaceholder(content));
    return new Section(
        prev.type(), prev.title(), content, prev.order(), prev.confidence(), metadata);
  }

  /**
   * The part of the final content that comes from the generator: the whole candidate for {@code
   * REPLACE}, the new tail for {@code APPEND}, the new lines for {@code MERGE}.
   */
  String generatedPortion(String previous, String candidate, MergeStrategy strategy) {
    return switch (strategy) {
      case REPLACE -> candidate;
      case APPEND -> appendedTail(previous, candidate);
      case MERGE -> newLines(previous, candidate);
    };
  }

  private static String appendedTail(String previous, String candidate) {
    if (previous.isBlank()) {
      return candidate;
    }
    if (candidate.startsWith(previous)) {
      return candidate.substring(previous.length()).strip();
    }
    return candidate;
  }

  private static String newLines(String previous, String candidate) {
    Set<String> seen = new HashSet<>();
    for (String line : previous.split("\n")) {
      if (!line.isBlank()) {
        seen.add(line.strip());
      }
    }
    List<String> added = new ArrayList<>();
    for (String line : candidate.split("\n")) {
      String trimmed = line.strip();
      if (!trimmed.isEmpty() && seen.add(trimmed)) {
        added.add(line);
      }
    }
    return String.join("\n", added);
  }

  private static ChangeAction actionFor(MergeStrategy strategy) {
    return strategy == MergeStrategy.REPLACE ? ChangeAction.UPDATED : ChangeAction.MERGED;
  }

  static String reasonFor(MergeStrategy strategy, String providerId, boolean fallbackUsed) {
    String reason =
        switch (strategy) {
          case REPLACE -> "replaced with regenerated content";
          case APPEND -> "regenerated content appended to previous content";
          case MERGE -> "new lines from regenerated content merged into previous content";
        };
    return fallbackUsed ? reason + " via fallback provider '" + providerId + "'" : reason;
  }

  private static String matchKey(Section section) {
    if (section.type() == SectionType.OTHER) {
      String heading = WHITESPACE.matcher(section.heading().strip()).replaceAll(" ");
      return "OTHER|" + heading.toLowerCase(Locale.ROOT);
    }
    return section.type().name();
  }

  private static String describeHeading(Section section) {
    return section.heading().isBlank() ? "" : " ('" + section.heading() + "')";
  }

  private static int wordCount(String content) {
    String trimmed = content == null ? "" : content.strip();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }

  /**
   * One section of the spliced note.
   *
   * @param previous section of the previous note
   * @param output section of the final note
   * @param action ledger action
   * @param strategy strategy applied, null when the previous content was kept
   * @param generatedPortion generator-sourced part of the output content, null when none
   * @param reason ledger reason
   * @param confidence candidate confidence for changed sections, previous confidence otherwise
   * @param providerId provider of the generated portion, null when none
   * @param omitted whether the section was selected but missing from the candidate
   */
  public record SplicedSection(
      Section previous,
      Section output,
      ChangeAction action,
      MergeStrategy strategy,
      String generatedPortion,
      String reason,
      double confidence,
      String providerId,
      boolean omitted) {

    static SplicedSection preserved(Section previous, String reason) {
      return new SplicedSection(
          previous,
          previous,
          ChangeAction.PRESERVED,
          null,
          null,
          reason,
          previous.confidence(),
          null,
          false);
    }

    static SplicedSection omitted(Section previous, String reason) {
      return new SplicedSection(
          previous,
          previous,
          ChangeAction.PRESERVED,
          null,
          null,
          reason,
          previous.confidence(),
          null,
          true);
    }

    public boolean hasGeneratedContent() {
      return generatedPortion != null;
    }

    /** Copy with new output content, a new generator portion and a reason suffix. */
    public SplicedSection withSanitizedPortion(
        Section newOutput, String sanitizedPortion, String reasonSuffix) {
      return new SplicedSection(
          previous,
          newOutput,
          action,
          strategy,
          sanitizedPortion,
          reason + reasonSuffix,
          confidence,
          providerId,
          omitted);
    }
  }

  /**
   * Output of {@link #splice}.
   *
   * @param sections spliced sections in previous-note order
   * @param warnings omitted and discarded sections
   */
  public record SpliceResult(List<SplicedSection> sections, List<String> warnings) {

    public SpliceResult {
      sections = List.copyOf(sections);
      warnings = List.copyOf(warnings);
    }

    public List<Section> outputSections() {
      return sections.stream().map(SplicedSection::output).toList();
    }

    public long omittedCount() {
      return sections.stream().filter(SplicedSection::omitted).count();
    }
  }
}
