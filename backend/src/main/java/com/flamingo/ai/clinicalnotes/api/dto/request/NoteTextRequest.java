package com.flamingo.ai.clinicalnotes.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying a note to parse, validate or sanitize. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteTextRequest {

  @NotNull(message = "Note text is required")
  @Size(max = 200_000, message = "Note text must be at most 200000 characters")
  private String noteText;

  /** EMR profile id; the default profile is used when absent. */
  private String profileId;
}
