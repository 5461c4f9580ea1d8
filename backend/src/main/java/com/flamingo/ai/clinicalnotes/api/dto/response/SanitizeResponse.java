package com.flamingo.ai.clinicalnotes.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for sanitized note text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SanitizeResponse {

  private String text;
  private String profileId;
  private boolean changed;
}
