package com.flamingo.ai.clinicalnotes.service.parsing;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of an alias table resource.
 *
 * <p>Entry order is significant: it is the declaration order used to break ties between aliases
 * of equal length.
 *
 * @param id table identifier referenced by EMR profiles
 * @param sections per-type headings and keyword bags, in declaration order
 * @param buckets keyword lexicons for the heuristic split of notes without headings
 */
public record AliasTableDefinition(
    String id, List<SectionAliases> sections, Map<SectionType, List<String>> buckets) {

  /**
   * Headings and keywords for one section type.
   *
   * @param type canonical section type
   * @param canonical canonical heading names (tier 1)
   * @param aliases known alternative headings (tier 2)
   * @param keywords body keywords used when a heading is not in the table (tier 3)
   */
  public record SectionAliases(
      SectionType type, List<String> canonical, List<String> aliases, List<String> keywords) {}
}
