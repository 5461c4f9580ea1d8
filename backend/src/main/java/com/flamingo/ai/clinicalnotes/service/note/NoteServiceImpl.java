package com.flamingo.ai.clinicalnotes.service.note;

import com.flamingo.ai.clinicalnotes.api.dto.request.SectionSelectionRequest;
import com.flamingo.ai.clinicalnotes.api.dto.request.TransferOfCareRequest;
import com.flamingo.ai.clinicalnotes.api.dto.response.SanitizeResponse;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.service.compliance.ComplianceValidator;
import com.flamingo.ai.clinicalnotes.service.compliance.EmrProfileRegistry;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import com.flamingo.ai.clinicalnotes.service.compliance.model.ValidationResult;
import com.flamingo.ai.clinicalnotes.service.generation.GatewayPair;
import com.flamingo.ai.clinicalnotes.service.merge.SelectiveUpdateService;
import com.flamingo.ai.clinicalnotes.service.merge.model.CancellationToken;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergeRequest;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergedNote;
import com.flamingo.ai.clinicalnotes.service.merge.model.SectionSelection;
import com.flamingo.ai.clinicalnotes.service.merge.model.SelectionConfig;
import com.flamingo.ai.clinicalnotes.service.parsing.SectionParser;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link NoteService} over the parser, validator and merge engine. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NoteServiceImpl implements NoteService {

  private final EmrProfileRegistry profileRegistry;
  private final SectionParser sectionParser;
  private final ComplianceValidator complianceValidator;
  private final SelectiveUpdateService selectiveUpdateService;
  private final GatewayPair gatewayPair;

  @Override
  @Timed(value = "notes.parse", description = "Time to parse a note")
  public ParsedNote parse(String noteText, String profileId) {
    EmrProfile profile = profileRegistry.getOrDefault(profileId);
    ParsedNote parsed = sectionParser.parse(noteText, profile);
    log.debug(
        "Parsed note with profile {}: {} sections, format {}",
        profile.id(),
        parsed.sections().size(),
        parsed.parseMetadata().detectedFormat());
    return parsed;
  }

  @Override
  @Timed(value = "notes.validate", description = "Time to validate a note")
  public ValidationResult validate(String noteText, String profileId) {
    return complianceValidator.validate(noteText, profileRegistry.getOrDefault(profileId));
  }

  @Override
  public SanitizeResponse sanitize(String noteText, String profileId) {
    EmrProfile profile = profileRegistry.getOrDefault(profileId);
    String text = complianceValidator.sanitize(noteText, profile);
    return SanitizeResponse.builder()
        .text(text)
        .profileId(profile.id())
        .changed(!text.equals(noteText))
        .build();
  }

  @Override
  @Timed(value = "notes.transfer_of_care", description = "Time to run a transfer-of-care update")
  public MergedNote transferOfCare(TransferOfCareRequest request) {
    EmrProfile profile = profileRegistry.getOrDefault(request.getProfileId());
    ParsedNote previous = sectionParser.parse(request.getPreviousNote(), profile);
    SelectionConfig selection = toSelection(request.getSections());
    Duration timeout =
        request.getCallTimeoutSeconds() == null
            ? null
            : Duration.ofSeconds(request.getCallTimeoutSeconds());

    log.info(
        "Transfer-of-care update with profile {}: {} sections in previous note, selected {}",
        profile.id(),
        previous.sections().size(),
        selection.selectedTypes());

    MergeRequest mergeRequest =
        new MergeRequest(
            previous,
            request.getTranscript(),
            selection,
            profile,
            timeout,
            CancellationToken.none());
    return selectiveUpdateService.mergeUpdate(mergeRequest, gatewayPair);
  }

  private static SelectionConfig toSelection(Map<SectionType, SectionSelectionRequest> sections) {
    Map<SectionType, SectionSelection> selections = new EnumMap<>(SectionType.class);
    if (sections != null) {
      sections.forEach(
          (type, choice) -> {
            if (type != null && choice != null) {
              selections.put(
                  type, new SectionSelection(choice.isShouldUpdate(), choice.getMergeStrategy()));
            }
          });
    }
    return SelectionConfig.of(selections);
  }
}
