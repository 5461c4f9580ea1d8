package com.flamingo.ai.clinicalnotes.api.dto.request;

import com.flamingo.ai.clinicalnotes.domain.enums.MergeStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Update choice for one section type. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionSelectionRequest {

  private boolean shouldUpdate;

  /** Defaults to REPLACE when absent. */
  private MergeStrategy mergeStrategy;
}
