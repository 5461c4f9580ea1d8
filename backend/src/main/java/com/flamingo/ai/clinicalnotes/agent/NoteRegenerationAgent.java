package com.flamingo.ai.clinicalnotes.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that rewrites a clinical note with information from a new visit transcript.
 *
 * <p>Returns the complete updated note as plain text. The caller only keeps the sections it asked
 * to update; everything else in the response is discarded.
 */
public interface NoteRegenerationAgent {

  @SystemMessage(
      """
        You are a clinical documentation specialist preparing a transfer-of-care note
        for a behavioral health clinic. You receive the previous note and the transcript
        of a new visit. Return the COMPLETE updated note using the same section headings,
        in the same order, as the previous note.

        Rules:
        - Only rewrite the sections listed as selected for update, using facts from the transcript.
        - Copy every other section unchanged.
        - Never invent findings, medications, doses or diagnoses absent from the note
          and the transcript.
        - Do not add sections that are not in the previous note.
        - Do not wrap the note in code fences and do not add any introduction or closing remarks.
        - Target EMR profile: {{profileId}}. Forbidden content: {{complianceRules}}.
        """)
  @UserMessage(
      """
        Sections selected for update: {{allowedSections}}

        {{strictInstructions}}

        PREVIOUS NOTE:
        {{previousNote}}

        NEW VISIT TRANSCRIPT:
        {{transcript}}
        """)
  String regenerate(
      @V("profileId") String profileId,
      @V("complianceRules") String complianceRules,
      @V("allowedSections") String allowedSections,
      @V("strictInstructions") String strictInstructions,
      @V("previousNote") String previousNote,
      @V("transcript") String transcript);
}
