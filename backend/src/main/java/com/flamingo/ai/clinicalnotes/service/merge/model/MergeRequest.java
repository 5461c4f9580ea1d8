package com.flamingo.ai.clinicalnotes.service.merge.model;

import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import java.time.Duration;

/**
 * Input of one selective update.
 *
 * @param previousNote the parsed previous note
 * @param transcript transcript of the new visit
 * @param selection per-type update choices
 * @param profile target EMR profile
 * @param callTimeout timeout of each provider call, null for the configured default
 * @param cancellationToken cancellation flag, null for none
 */
public record MergeRequest(
    ParsedNote previousNote,
    String transcript,
    SelectionConfig selection,
    EmrProfile profile,
    Duration callTimeout,
    CancellationToken cancellationToken) {

  public MergeRequest {
    cancellationToken = cancellationToken == null ? CancellationToken.none() : cancellationToken;
  }
}
