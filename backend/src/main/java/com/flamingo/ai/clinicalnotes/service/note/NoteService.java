package com.flamingo.ai.clinicalnotes.service.note;

import com.flamingo.ai.clinicalnotes.api.dto.request.TransferOfCareRequest;
import com.flamingo.ai.clinicalnotes.api.dto.response.SanitizeResponse;
import com.flamingo.ai.clinicalnotes.service.compliance.model.ValidationResult;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergedNote;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;

/** Service interface for the note operations exposed over REST. */
public interface NoteService {

  /**
   * Parses a note with the alias table of the given profile.
   *
   * @param noteText note text
   * @param profileId EMR profile id, the default profile when blank
   * @return the parsed note
   */
  ParsedNote parse(String noteText, String profileId);

  /**
   * Validates a note against an EMR profile.
   *
   * @param noteText note text
   * @param profileId EMR profile id, the default profile when blank
   * @return the validation result
   */
  ValidationResult validate(String noteText, String profileId);

  /**
   * Strips forbidden tokens from a note.
   *
   * @param noteText note text
   * @param profileId EMR profile id, the default profile when blank
   * @return the sanitized text and the profile it was sanitized for
   */
  SanitizeResponse sanitize(String noteText, String profileId);

  /**
   * Regenerates the selected sections of a previous note from a new visit transcript.
   *
   * @param request previous note, transcript, profile and section choices
   * @return the merged note
   */
  MergedNote transferOfCare(TransferOfCareRequest request);
}
