package com.flamingo.ai.clinicalnotes.api.dto.request;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a transfer-of-care selective update. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferOfCareRequest {

  @NotBlank(message = "Previous note is required")
  @Size(max = 200_000, message = "Previous note must be at most 200000 characters")
  private String previousNote;

  @NotNull(message = "Transcript is required")
  @Size(max = 400_000, message = "Transcript must be at most 400000 characters")
  private String transcript;

  private String profileId;

  /** Per-type choices; types not listed are preserved. */
  private Map<SectionType, SectionSelectionRequest> sections;

  /** Overrides the configured per-call provider timeout. */
  @Positive(message = "Call timeout must be positive")
  private Integer callTimeoutSeconds;
}
