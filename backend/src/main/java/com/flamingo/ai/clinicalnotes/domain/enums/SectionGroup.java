package com.flamingo.ai.clinicalnotes.domain.enums;

/** Coarse grouping of section types, used for display and for listing profiles. */
public enum SectionGroup {
  PATIENT_INFO,
  MEDICATIONS,
  CLINICAL_ASSESSMENT,
  EXAMINATION,
  PLAN_AND_SAFETY,
  FOLLOW_UP,
  LEGACY_SOAP,
  UNCLASSIFIED
}
