package com.flamingo.ai.clinicalnotes.service.parsing;

import com.flamingo.ai.clinicalnotes.domain.enums.AliasTier;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Table-driven mapping from raw headings and body keywords to canonical section types.
 *
 * <p>Instances are immutable and safe to share between threads. Lookups are case-insensitive and
 * ignore heading decoration (markdown markers, emphasis, trailing colon).
 */
public final class AliasTable {

  private static final Pattern DECORATION_PREFIX = Pattern.compile("^[#*_\\s]+");
  private static final Pattern DECORATION_SUFFIX = Pattern.compile("[*_\\s:]+$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Prefix matches are only allowed for entries at least this long. */
  private static final int MIN_PREFIX_ALIAS_LENGTH = 3;

  /** Minimum distinct keyword hits for a tier-3 classification. */
  static final int MIN_KEYWORD_HITS = 2;

  private final String id;

  /** Entries ordered by alias length descending, then declaration order. */
  private final List<Entry> entries;

  private final Map<SectionType, List<Pattern>> keywordBags;
  private final Map<SectionType, List<Pattern>> buckets;

  private AliasTable(
      String id,
      List<Entry> entries,
      Map<SectionType, List<Pattern>> keywordBags,
      Map<SectionType, List<Pattern>> buckets) {
    this.id = id;
    this.entries = entries;
    this.keywordBags = keywordBags;
    this.buckets = buckets;
  }

  /**
   * Builds a table from its JSON definition.
   *
   * @throws IllegalArgumentException if the definition has no id or maps to a non-canonical type
   */
  public static AliasTable fromDefinition(AliasTableDefinition definition) {
    if (definition == null || definition.id() == null || definition.id().isBlank()) {
      throw new IllegalArgumentException("Alias table definition requires an id");
    }

    List<Entry> entries = new ArrayList<>();
    Map<SectionType, List<Pattern>> keywordBags = new LinkedHashMap<>();
    int declarationIndex = 0;

    List<AliasTableDefinition.SectionAliases> sections =
        definition.sections() == null ? List.of() : definition.sections();
    for (AliasTableDefinition.SectionAliases section : sections) {
      SectionType type = section.type();
      if (type == null || !type.isCanonical()) {
        throw new IllegalArgumentException(
            "Alias table '" + definition.id() + "' maps to non-canonical type " + type);
      }
      for (String name : nullSafe(section.canonical())) {
        entries.add(new Entry(type, AliasTier.CANONICAL, normalize(name), declarationIndex++));
      }
      for (String alias : nullSafe(section.aliases())) {
        entries.add(new Entry(type, AliasTier.ALIAS, normalize(alias), declarationIndex++));
      }
      List<Pattern> keywords = compileKeywords(section.keywords());
      if (!keywords.isEmpty()) {
        keywordBags.merge(type, keywords, AliasTable::concat);
      }
    }

    entries.removeIf(entry -> entry.alias().isEmpty());
    entries.sort(
        Comparator.comparingInt((Entry entry) -> entry.alias().length())
            .reversed()
            .thenComparingInt(Entry::declarationIndex));

    Map<SectionType, List<Pattern>> buckets = new EnumMap<>(SectionType.class);
    if (definition.buckets() != null) {
      definition.buckets().forEach((type, words) -> buckets.put(type, compileKeywords(words)));
    }

    return new AliasTable(
        definition.id(), List.copyOf(entries), Map.copyOf(keywordBags), Map.copyOf(buckets));
  }

  public String id() {
    return id;
  }

  /**
   * Resolves a heading to a section type.
   *
   * <p>A heading matches an entry when it equals the entry or, if {@code allowPrefix} is set,
   * starts with it followed by a non-letter. The longest matching entry wins; ties go to the entry
   * declared first. Prefix matches never rank above the alias tier.
   *
   * @param heading raw heading text, decoration and trailing colon allowed
   * @param allowPrefix whether the heading may carry extra words after a known entry
   * @return the match, or empty if nothing in the table matches
   */
  public Optional<AliasMatch> resolve(String heading, boolean allowPrefix) {
    String normalized = normalize(heading);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }

    Entry best = null;
    boolean bestExact = false;
    boolean ambiguous = false;
    for (Entry entry : entries) {
      if (best != null && entry.alias().length() < best.alias().length()) {
        break;
      }
      boolean exact = normalized.equals(entry.alias());
      boolean prefix =
          !exact
              && allowPrefix
              && entry.alias().length() >= MIN_PREFIX_ALIAS_LENGTH
              && isPrefixMatch(normalized, entry.alias());
      if (!exact && !prefix) {
        continue;
      }
      if (best == null) {
        best = entry;
        bestExact = exact;
      } else if (entry.type() != best.type()) {
        ambiguous = true;
      }
    }

    if (best == null) {
      return Optional.empty();
    }
    AliasTier tier = bestExact ? best.tier() : AliasTier.ALIAS;
    return Optional.of(new AliasMatch(best.type(), tier, best.alias(), ambiguous));
  }

  /**
   * Classifies a section body by keyword bag: the type with the most distinct keyword hits, if it
   * has at least two. Ties go to the type declared first.
   */
  public Optional<SectionType> classifyByKeywords(String body) {
    if (body == null || body.isBlank()) {
      return Optional.empty();
    }
    String lower = body.toLowerCase(Locale.ROOT);

    SectionType bestType = null;
    int bestHits = 0;
    for (Map.Entry<SectionType, List<Pattern>> bag : orderedKeywordBags()) {
      int hits = countHits(lower, bag.getValue());
      if (hits >= MIN_KEYWORD_HITS && hits > bestHits) {
        bestType = bag.getKey();
        bestHits = hits;
      }
    }
    return Optional.ofNullable(bestType);
  }

  /**
   * Scores a text fragment against each heuristic bucket.
   *
   * @return distinct keyword hits per bucket type, for buckets with at least one hit
   */
  public Map<SectionType, Integer> bucketScores(String text) {
    Map<SectionType, Integer> scores = new EnumMap<>(SectionType.class);
    if (text == null || text.isBlank()) {
      return scores;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    buckets.forEach(
        (type, words) -> {
          int hits = countHits(lower, words);
          if (hits > 0) {
            scores.put(type, hits);
          }
        });
    return scores;
  }

  /** Normalizes a heading for lookup: lower case, no decoration, single spaces. */
  static String normalize(String heading) {
    if (heading == null) {
      return "";
    }
    String value = DECORATION_PREFIX.matcher(heading).replaceFirst("");
    value = DECORATION_SUFFIX.matcher(value).replaceFirst("");
    value = WHITESPACE.matcher(value).replaceAll(" ");
    return value.trim().toLowerCase(Locale.ROOT);
  }

  private List<Map.Entry<SectionType, List<Pattern>>> orderedKeywordBags() {
    // Map.copyOf loses insertion order; rebuild it from the entry declaration order
    List<Map.Entry<SectionType, List<Pattern>>> ordered = new ArrayList<>();
    entries.stream()
        .sorted(Comparator.comparingInt(Entry::declarationIndex))
        .map(Entry::type)
        .distinct()
        .forEach(
            type -> {
              List<Pattern> bag = keywordBags.get(type);
              if (bag != null) {
                ordered.add(Map.entry(type, bag));
              }
            });
    keywordBags.forEach(
        (type, bag) -> {
          if (ordered.stream().noneMatch(entry -> entry.getKey() == type)) {
            ordered.add(Map.entry(type, bag));
          }
        });
    return ordered;
  }

  private static boolean isPrefixMatch(String heading, String alias) {
    return heading.length() > alias.length()
        && heading.startsWith(alias)
        && !Character.isLetter(heading.charAt(alias.length()));
  }

  private static int countHits(String lowerText, List<Pattern> words) {
    int hits = 0;
    for (Pattern word : words) {
      if (word.matcher(lowerText).find()) {
        hits++;
      }
    }
    return hits;
  }

  private static List<Pattern> compileKeywords(List<String> keywords) {
    List<Pattern> patterns = new ArrayList<>();
    for (String keyword : nullSafe(keywords)) {
      String word = keyword.trim().toLowerCase(Locale.ROOT);
      if (!word.isEmpty()) {
        patterns.add(Pattern.compile("(?<![a-z0-9])" + Pattern.quote(word) + "(?![a-z0-9])"));
      }
    }
    return List.copyOf(patterns);
  }

  private static List<Pattern> concat(List<Pattern> first, List<Pattern> second) {
    List<Pattern> joined = new ArrayList<>(first);
    joined.addAll(second);
    return List.copyOf(joined);
  }

  private static List<String> nullSafe(List<String> values) {
    return values == null ? List.of() : values;
  }

  private record Entry(SectionType type, AliasTier tier, String alias, int declarationIndex) {}
}
