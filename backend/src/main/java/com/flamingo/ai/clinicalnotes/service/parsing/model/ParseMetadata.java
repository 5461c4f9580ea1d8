package com.flamingo.ai.clinicalnotes.service.parsing.model;

import com.flamingo.ai.clinicalnotes.domain.enums.NoteFormat;
import java.util.List;

/**
 * Summary of a parse call.
 *
 * @param overallConfidence content-length weighted average of section confidences
 * @param standardizedSectionCount sections with confidence of at least 0.8
 * @param warnings non-fatal parse warnings, in the order they were raised
 * @param detectedFormat layout family of the note
 */
public record ParseMetadata(
    double overallConfidence,
    int standardizedSectionCount,
    List<String> warnings,
    NoteFormat detectedFormat) {}
