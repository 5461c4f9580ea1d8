package com.flamingo.ai.clinicalnotes.api.rest;

import com.flamingo.ai.clinicalnotes.api.dto.request.NoteTextRequest;
import com.flamingo.ai.clinicalnotes.api.dto.request.TransferOfCareRequest;
import com.flamingo.ai.clinicalnotes.api.dto.response.SanitizeResponse;
import com.flamingo.ai.clinicalnotes.service.compliance.model.ValidationResult;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergedNote;
import com.flamingo.ai.clinicalnotes.service.note.NoteService;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for note parsing, compliance and transfer-of-care updates. */
@RestController
@RequestMapping("/api/notes")
@RequiredArgsConstructor
public class NoteController {

  private final NoteService noteService;

  /** Splits a note into typed sections. */
  @PostMapping("/parse")
  public ResponseEntity<ParsedNote> parse(@Valid @RequestBody NoteTextRequest request) {
    return ResponseEntity.ok(noteService.parse(request.getNoteText(), request.getProfileId()));
  }

  /** Checks a note against an EMR profile. */
  @PostMapping("/validate")
  public ResponseEntity<ValidationResult> validate(@Valid @RequestBody NoteTextRequest request) {
    return ResponseEntity.ok(noteService.validate(request.getNoteText(), request.getProfileId()));
  }

  /** Strips forbidden tokens from a note. */
  @PostMapping("/sanitize")
  public ResponseEntity<SanitizeResponse> sanitize(@Valid @RequestBody NoteTextRequest request) {
    return ResponseEntity.ok(noteService.sanitize(request.getNoteText(), request.getProfileId()));
  }

  /** Regenerates the selected sections of a previous note from a new visit transcript. */
  @PostMapping("/transfer-of-care")
  public ResponseEntity<MergedNote> transferOfCare(
      @Valid @RequestBody TransferOfCareRequest request) {
    return ResponseEntity.ok(noteService.transferOfCare(request));
  }
}
