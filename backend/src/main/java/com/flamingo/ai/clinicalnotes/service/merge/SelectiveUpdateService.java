package com.flamingo.ai.clinicalnotes.service.merge;

import com.flamingo.ai.clinicalnotes.exception.MergeCancelledException;
import com.flamingo.ai.clinicalnotes.exception.NoteConfigurationException;
import com.flamingo.ai.clinicalnotes.exception.ProvidersExhaustedException;
import com.flamingo.ai.clinicalnotes.service.generation.GatewayPair;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergeRequest;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergedNote;

/** Service that regenerates the selected sections of a note and keeps everything else verbatim. */
public interface SelectiveUpdateService {

  /**
   * Produces an updated note from a previous note and a new visit transcript.
   *
   * <p>Sections not selected for update keep their previous content exactly, whatever the
   * providers return. The result always has the previous note's section sequence.
   *
   * @param request previous note, transcript, selection, profile and call options
   * @param gateways primary and fallback providers
   * @return the merged note with its change ledger and validation result
   * @throws NoteConfigurationException if the request is incomplete or selects absent sections
   * @throws ProvidersExhaustedException if neither provider produced a first candidate
   * @throws MergeCancelledException if the request's cancellation token is set
   */
  MergedNote mergeUpdate(MergeRequest request, GatewayPair gateways);
}
