package com.flamingo.ai.clinicalnotes.service.generation;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import java.util.List;

/**
 * Input of a single generation call.
 *
 * @param fullContextText the complete previous note, rendered
 * @param transcriptText transcript of the new visit
 * @param allowedSectionTypes sections the generator may rewrite
 * @param complianceProfileId target EMR profile id
 * @param complianceRules names of the forbidden-token rules of the profile
 * @param strict whether this is the stricter retry
 * @param violationsToAvoid violations of the previous attempt, described for the model
 */
public record GenerationRequest(
    String fullContextText,
    String transcriptText,
    List<SectionType> allowedSectionTypes,
    String complianceProfileId,
    List<String> complianceRules,
    boolean strict,
    List<String> violationsToAvoid) {

  public GenerationRequest {
    allowedSectionTypes = List.copyOf(allowedSectionTypes);
    complianceRules = List.copyOf(complianceRules);
    violationsToAvoid = violationsToAvoid == null ? List.of() : List.copyOf(violationsToAvoid);
  }

  /** Returns a stricter copy scoped to the given sections, listing the violations to avoid. */
  public GenerationRequest strictRetry(
      List<SectionType> retrySections, List<String> violationsToAvoid) {
    return new GenerationRequest(
        fullContextText,
        transcriptText,
        retrySections,
        complianceProfileId,
        complianceRules,
        true,
        violationsToAvoid);
  }
}
