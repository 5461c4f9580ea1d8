package com.flamingo.ai.clinicalnotes.service.parsing;

import com.flamingo.ai.clinicalnotes.domain.enums.AliasTier;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;

/**
 * Outcome of resolving a heading against an {@link AliasTable}.
 *
 * @param type resolved section type
 * @param tier tier of the winning entry
 * @param alias the table entry that matched
 * @param ambiguous whether another type matched with an entry of the same length
 */
public record AliasMatch(SectionType type, AliasTier tier, String alias, boolean ambiguous) {}
