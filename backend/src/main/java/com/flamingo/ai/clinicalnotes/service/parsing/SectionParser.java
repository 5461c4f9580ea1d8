package com.flamingo.ai.clinicalnotes.service.parsing;

import com.flamingo.ai.clinicalnotes.domain.enums.AliasTier;
import com.flamingo.ai.clinicalnotes.domain.enums.NoteFormat;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.exception.NoteConfigurationException;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParseMetadata;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import com.flamingo.ai.clinicalnotes.service.parsing.model.Section;
import com.flamingo.ai.clinicalnotes.service.parsing.model.SectionMetadata;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits free-form clinical note text into typed sections.
 *
 * <p>Headings are recognized structurally (markdown headings, title-like lines ending in a colon,
 * ALL-CAPS lines), by exact lookup in the profile's alias table, or as an inline {@code Heading:
 * text} prefix. Each heading is resolved through the alias table tiers; headings that resolve to
 * nothing become {@link SectionType#OTHER} sections and are never dropped. Text before the first
 * heading is kept as an {@code OTHER} preamble.
 *
 * <p>When no heading is found, paragraphs are classified into SOAP buckets by keyword. When that
 * fails too, the whole text is returned as a single {@link SectionType#UNSTRUCTURED} section.
 *
 * <p>The parser never throws on malformed note text; only a missing profile is rejected.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SectionParser {

  static final String HEURISTIC_SPLIT_WARNING =
      "no recognized section headings; heuristic split applied";
  static final String UNSTRUCTURED_WARNING =
      "no recognized section headings or keywords; note kept as unstructured text";

  private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s+(.+?)\\s*#*$");
  private static final Pattern COLON_HEADING =
      Pattern.compile("^[A-Z][A-Za-z0-9 _/&()'.,-]{0,60}:\\s*$");
  // Unresolved ALL-CAPS lines: letters and separators only, so coded entries stay body text.
  private static final Pattern CAPS_HEADING = Pattern.compile("^[A-Z][A-Z _/-]*$");
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final int MAX_HEADING_LENGTH = 80;
  private static final int MIN_CAPS_HEADING_LENGTH = 8;
  private static final int MAX_CAPS_HEADING_LENGTH = 60;
  private static final int MAX_INLINE_PREFIX_LENGTH = 40;

  private static final double HEURISTIC_BASE_CONFIDENCE = 0.25;
  private static final double HEURISTIC_CONFIDENCE_PER_HIT = 0.05;
  private static final double HEURISTIC_MAX_CONFIDENCE = 0.5;

  private static final List<SectionType> SOAP_ORDER =
      List.of(
          SectionType.SUBJECTIVE, SectionType.OBJECTIVE, SectionType.ASSESSMENT, SectionType.PLAN);

  private final MeterRegistry meterRegistry;

  /**
   * Parses note text with the alias table of the given profile.
   *
   * @param rawText note text, may be null or blank
   * @param profile EMR profile providing the alias table
   * @return parsed note, never null
   * @throws NoteConfigurationException if the profile or its alias table is missing
   */
  public ParsedNote parse(String rawText, EmrProfile profile) {
    if (profile == null || profile.aliasTable() == null) {
      throw new NoteConfigurationException("An EMR profile with an alias table is required");
    }
    if (rawText == null || rawText.isBlank()) {
      return unstructured("", "empty note text");
    }

    String text = normalizeLineEndings(rawText);
    try {
      return parseNormalized(text, profile.aliasTable());
    } catch (RuntimeException e) {
      log.warn("Falling back to unstructured note after parse failure: {}", e.getMessage(), e);
      return unstructured(text.strip(), "note could not be split into sections: " + e.getMessage());
    }
  }

  private ParsedNote parseNormalized(String text, AliasTable table) {
    List<RawSection> rawSections = new ArrayList<>();
    List<String> preamble = new ArrayList<>();
    RawSection current = null;

    for (String line : text.split("\n", -1)) {
      // An inline body is scanned like a line of its own, so it may open further sections.
      String pending = line;
      while (pending != null) {
        Optional<HeadingCandidate> heading = detectHeading(pending, table);
        if (heading.isPresent()) {
          current = new RawSection(heading.get());
          rawSections.add(current);
          pending = heading.get().inlineBody();
        } else {
          if (current == null) {
            preamble.add(pending);
          } else {
            current.lines.add(pending);
          }
          pending = null;
        }
      }
    }

    if (rawSections.isEmpty()) {
      return heuristicSplit(text, table);
    }

    List<String> warnings = new ArrayList<>();
    List<Section> sections = new ArrayList<>();
    String preambleText = joinTrimmed(preamble);
    if (!preambleText.isEmpty()) {
      sections.add(
          buildSection(
              SectionType.OTHER,
              SectionType.OTHER.getDisplayTitle(),
              preambleText,
              0,
              AliasTier.UNRESOLVED.getConfidence(),
              ""));
    }

    Set<SectionType> seen = EnumSet.noneOf(SectionType.class);
    for (RawSection raw : rawSections) {
      String body = joinTrimmed(raw.lines);
      HeadingCandidate heading = raw.heading;

      SectionType type;
      double confidence;
      if (heading.match() != null) {
        type = heading.match().type();
        confidence = heading.match().tier().getConfidence();
        if (heading.match().ambiguous()) {
          warnings.add(
              "ambiguous heading '"
                  + heading.originalHeading()
                  + "' matched several section types; resolved to "
                  + type);
        }
      } else {
        Optional<SectionType> byKeywords = table.classifyByKeywords(body);
        type = byKeywords.orElse(SectionType.OTHER);
        confidence =
            byKeywords.isPresent()
                ? AliasTier.KEYWORD.getConfidence()
                : AliasTier.UNRESOLVED.getConfidence();
      }

      if (type != SectionType.OTHER && !seen.add(type)) {
        warnings.add(
            "duplicate section type " + type + " at heading '" + heading.originalHeading() + "'");
      }
      if (body.isEmpty()) {
        warnings.add("empty section body under heading '" + heading.originalHeading() + "'");
      }

      String title = type == SectionType.OTHER ? heading.headingText() : type.getDisplayTitle();
      sections.add(
          buildSection(type, title, body, sections.size(), confidence, heading.originalHeading()));
    }

    return withMetadata(sections, warnings);
  }

  private Optional<HeadingCandidate> detectHeading(String line, AliasTable table) {
    String trimmed = line.strip();
    if (trimmed.isEmpty() || trimmed.length() > MAX_HEADING_LENGTH) {
      return Optional.empty();
    }

    Matcher markdown = MARKDOWN_HEADING.matcher(trimmed);
    if (markdown.matches()) {
      String text = stripColon(markdown.group(1));
      return Optional.of(
          new HeadingCandidate(trimmed, text, table.resolve(text, true).orElse(null), null));
    }

    if (COLON_HEADING.matcher(trimmed).matches()) {
      String text = stripColon(trimmed);
      return Optional.of(
          new HeadingCandidate(trimmed, text, table.resolve(text, true).orElse(null), null));
    }

    Optional<AliasMatch> exact = table.resolve(trimmed, false);
    if (exact.isPresent()) {
      return Optional.of(
          new HeadingCandidate(trimmed, stripColon(trimmed), exact.get(), null));
    }

    if (isAllCapsHeading(trimmed)) {
      Optional<AliasMatch> match = table.resolve(trimmed, true);
      if (match.isPresent() || CAPS_HEADING.matcher(trimmed).matches()) {
        return Optional.of(
            new HeadingCandidate(trimmed, stripColon(trimmed), match.orElse(null), null));
      }
    }

    return detectInlineHeading(trimmed, table);
  }

  private Optional<HeadingCandidate> detectInlineHeading(String trimmed, AliasTable table) {
    int colon = trimmed.indexOf(':');
    if (colon <= 0 || colon > MAX_INLINE_PREFIX_LENGTH) {
      return Optional.empty();
    }
    String prefix = trimmed.substring(0, colon).strip();
    String rest = trimmed.substring(colon + 1).strip();
    if (rest.isEmpty()) {
      return Optional.empty();
    }
    return table
        .resolve(prefix, false)
        .filter(match -> match.tier() == AliasTier.CANONICAL || match.tier() == AliasTier.ALIAS)
        .map(match -> new HeadingCandidate(prefix + ":", prefix, match, rest));
  }

  private static boolean isAllCapsHeading(String trimmed) {
    return trimmed.contains(" ")
        && trimmed.length() >= MIN_CAPS_HEADING_LENGTH
        && trimmed.length() <= MAX_CAPS_HEADING_LENGTH
        && trimmed.chars().anyMatch(Character::isLetter)
        && trimmed.chars().noneMatch(Character::isLowerCase);
  }

  private ParsedNote heuristicSplit(String text, AliasTable table) {
    Map<SectionType, List<String>> paragraphsByBucket = new EnumMap<>(SectionType.class);
    Map<SectionType, Integer> hitsByBucket = new EnumMap<>(SectionType.class);
    List<String> pending = new ArrayList<>();
    SectionType previous = null;

    for (String paragraph : PARAGRAPH_BREAK.split(text)) {
      String trimmed = paragraph.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      Optional<Map.Entry<SectionType, Integer>> best =
          table.bucketScores(trimmed).entrySet().stream()
              .max(
                  (a, b) ->
                      a.getValue().equals(b.getValue())
                          ? Integer.compare(b.getKey().ordinal(), a.getKey().ordinal())
                          : Integer.compare(a.getValue(), b.getValue()));

      if (best.isEmpty()) {
        if (previous == null) {
          pending.add(trimmed);
        } else {
          paragraphsByBucket.get(previous).add(trimmed);
        }
        continue;
      }

      SectionType bucket = best.get().getKey();
      List<String> paragraphs = paragraphsByBucket.computeIfAbsent(bucket, k -> new ArrayList<>());
      if (previous == null && !pending.isEmpty()) {
        paragraphs.addAll(pending);
        pending.clear();
      }
      paragraphs.add(trimmed);
      hitsByBucket.merge(bucket, best.get().getValue(), Integer::sum);
      previous = bucket;
    }

    if (paragraphsByBucket.isEmpty()) {
      return unstructured(text.strip(), UNSTRUCTURED_WARNING);
    }

    meterRegistry.counter("notes.parse.heuristic_split").increment();
    log.debug("Heuristic split produced buckets {}", paragraphsByBucket.keySet());

    List<Section> sections = new ArrayList<>();
    for (SectionType bucket : SOAP_ORDER) {
      List<String> paragraphs = paragraphsByBucket.get(bucket);
      if (paragraphs == null) {
        continue;
      }
      double confidence =
          Math.min(
              HEURISTIC_MAX_CONFIDENCE,
              HEURISTIC_BASE_CONFIDENCE
                  + HEURISTIC_CONFIDENCE_PER_HIT * hitsByBucket.getOrDefault(bucket, 0));
      sections.add(
          buildSection(
              bucket,
              bucket.getDisplayTitle(),
              String.join("\n\n", paragraphs),
              sections.size(),
              confidence,
              ""));
    }
    return withMetadata(sections, List.of(HEURISTIC_SPLIT_WARNING));
  }

  private ParsedNote unstructured(String text, String warning) {
    Section section =
        buildSection(
            SectionType.UNSTRUCTURED, SectionType.UNSTRUCTURED.getDisplayTitle(), text, 0, 0.0, "");
    return withMetadata(List.of(section), List.of(warning));
  }

  private static Section buildSection(
      SectionType type,
      String title,
      String content,
      int order,
      double confidence,
      String originalHeading) {
    SectionMetadata metadata =
        new SectionMetadata(
            originalHeading,
            wordCount(content),
            confidence >= AliasTier.ALIAS.getConfidence(),
            PlaceholderSyntax.containsPlaceholder(content));
    return new Section(type, title, content, order, confidence, metadata);
  }

  private static ParsedNote withMetadata(List<Section> sections, List<String> warnings) {
    double weighted = 0;
    double totalWeight = 0;
    int standardized = 0;
    for (Section section : sections) {
      int weight = Math.max(1, section.content().length());
      weighted += section.confidence() * weight;
      totalWeight += weight;
      if (section.metadata().standardized()) {
        standardized++;
      }
    }
    double overall = totalWeight == 0 ? 0 : weighted / totalWeight;
    return new ParsedNote(
        sections,
        new ParseMetadata(overall, standardized, List.copyOf(warnings), detectFormat(sections)));
  }

  static NoteFormat detectFormat(List<Section> sections) {
    Set<SectionType> soap = EnumSet.noneOf(SectionType.class);
    Set<SectionType> standard = EnumSet.noneOf(SectionType.class);
    for (Section section : sections) {
      if (section.type().isSoap()) {
        soap.add(section.type());
      } else if (section.type().isTransferOfCareStandard()) {
        standard.add(section.type());
      }
    }
    if (!soap.isEmpty() && !standard.isEmpty()) {
      return NoteFormat.MIXED;
    }
    if (soap.size() >= 3) {
      return NoteFormat.SOAP;
    }
    if (standard.size() >= 3) {
      return NoteFormat.STANDARDIZED;
    }
    return NoteFormat.UNKNOWN;
  }

  private static String normalizeLineEndings(String text) {
    return text.replace("\r\n", "\n").replace('\r', '\n');
  }

  /** Joins body lines, dropping leading and trailing blank lines only. */
  private static String joinTrimmed(List<String> lines) {
    int start = 0;
    int end = lines.size();
    while (start < end && lines.get(start).isBlank()) {
      start++;
    }
    while (end > start && lines.get(end - 1).isBlank()) {
      end--;
    }
    return String.join("\n", lines.subList(start, end));
  }

  private static String stripColon(String heading) {
    String value = heading.strip();
    while (value.endsWith(":")) {
      value = value.substring(0, value.length() - 1).strip();
    }
    return value;
  }

  private static int wordCount(String content) {
    String trimmed = content == null ? "" : content.strip();
    return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
  }

  private record HeadingCandidate(
      String originalHeading, String headingText, AliasMatch match, String inlineBody) {}

  private static final class RawSection {
    private final HeadingCandidate heading;
    private final List<String> lines = new ArrayList<>();

    private RawSection(HeadingCandidate heading) {
      this.heading = heading;
    }
  }
}
