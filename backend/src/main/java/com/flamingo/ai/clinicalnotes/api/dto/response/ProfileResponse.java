package com.flamingo.ai.clinicalnotes.api.dto.response;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO summarizing an EMR profile. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

  private String id;
  private String displayName;
  private String aliasTable;
  private List<String> forbiddenTokenRules;
  private boolean requiresCanonicalStructure;
  private List<SectionType> canonicalStructureSections;
  private int minLength;
  private int maxLength;
  private boolean defaultProfile;

  /** Creates a ProfileResponse from a loaded profile. */
  public static ProfileResponse fromProfile(EmrProfile profile, boolean defaultProfile) {
    return ProfileResponse.builder()
        .id(profile.id())
        .displayName(profile.displayName())
        .aliasTable(profile.aliasTable().id())
        .forbiddenTokenRules(profile.ruleNames())
        .requiresCanonicalStructure(profile.requiresCanonicalStructure())
        .canonicalStructureSections(profile.canonicalStructureSections())
        .minLength(profile.minLength())
        .maxLength(profile.maxLength())
        .defaultProfile(defaultProfile)
        .build();
  }
}
