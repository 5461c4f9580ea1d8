package com.flamingo.ai.clinicalnotes.domain.enums;

/**
 * Closed set of canonical clinical note section kinds.
 *
 * <p>Identifiers are stable and referenced by alias tables, profiles and callers' section
 * selections. {@link #OTHER} holds headings that could not be resolved and {@link #UNSTRUCTURED}
 * wraps text that could not be split at all; neither is ever produced by a table lookup.
 */
public enum SectionType {
  BASIC_DEMO_INFO("Basic Demo Information", SectionGroup.PATIENT_INFO, true),
  DIAGNOSIS("Diagnosis", SectionGroup.PATIENT_INFO, true),
  IDENTIFYING_INFO("Identifying Information", SectionGroup.PATIENT_INFO, true),
  CHIEF_COMPLAINT("Chief Complaint", SectionGroup.CLINICAL_ASSESSMENT, false),

  CURRENT_MEDICATIONS("Current Medications", SectionGroup.MEDICATIONS, true),
  BH_PRIOR_MEDS_TRIED("Behavioral Health Prior Meds Tried", SectionGroup.MEDICATIONS, true),
  MEDICATIONS_PLAN("Medication Changes", SectionGroup.MEDICATIONS, true),
  ALLERGIES("Allergies", SectionGroup.MEDICATIONS, false),

  HPI("History of Present Illness", SectionGroup.CLINICAL_ASSESSMENT, true),
  REVIEW_OF_SYSTEMS("Review of Systems", SectionGroup.CLINICAL_ASSESSMENT, true),
  PSYCHIATRIC_EXAM("Psychiatric Exam", SectionGroup.CLINICAL_ASSESSMENT, true),
  QUESTIONNAIRES_SURVEYS("Questionnaires/Surveys", SectionGroup.CLINICAL_ASSESSMENT, true),

  MEDICAL("Medical", SectionGroup.EXAMINATION, true),
  PHYSICAL_EXAM("Physical Exam", SectionGroup.EXAMINATION, true),
  VITALS("Vitals", SectionGroup.EXAMINATION, false),
  SOCIAL_HISTORY("Social History", SectionGroup.PATIENT_INFO, false),
  FAMILY_HISTORY("Family History", SectionGroup.PATIENT_INFO, false),

  RISKS("Risks", SectionGroup.PLAN_AND_SAFETY, true),
  ASSESSMENT_AND_PLAN("Assessment and Plan", SectionGroup.PLAN_AND_SAFETY, true),
  PSYCHOSOCIAL("Psychosocial", SectionGroup.PLAN_AND_SAFETY, true),
  SAFETY_PLAN("Safety Plan", SectionGroup.PLAN_AND_SAFETY, true),

  PROGNOSIS("Prognosis", SectionGroup.FOLLOW_UP, true),
  FOLLOW_UP("Follow-Up", SectionGroup.FOLLOW_UP, true),

  SUBJECTIVE("Subjective", SectionGroup.LEGACY_SOAP, false),
  OBJECTIVE("Objective", SectionGroup.LEGACY_SOAP, false),
  ASSESSMENT("Assessment", SectionGroup.LEGACY_SOAP, false),
  PLAN("Plan", SectionGroup.LEGACY_SOAP, false),

  OTHER("Other", SectionGroup.UNCLASSIFIED, false),
  UNSTRUCTURED("Unstructured", SectionGroup.UNCLASSIFIED, false);

  private final String displayTitle;
  private final SectionGroup group;
  private final boolean transferOfCareStandard;

  SectionType(String displayTitle, SectionGroup group, boolean transferOfCareStandard) {
    this.displayTitle = displayTitle;
    this.group = group;
    this.transferOfCareStandard = transferOfCareStandard;
  }

  public String getDisplayTitle() {
    return displayTitle;
  }

  public SectionGroup getGroup() {
    return group;
  }

  /** Whether the type belongs to the standardized transfer-of-care section list. */
  public boolean isTransferOfCareStandard() {
    return transferOfCareStandard;
  }

  /** Whether the type is one of the four legacy SOAP headings. */
  public boolean isSoap() {
    return group == SectionGroup.LEGACY_SOAP;
  }

  /** Whether the type can be produced by an alias table lookup. */
  public boolean isCanonical() {
    return this != OTHER && this != UNSTRUCTURED;
  }
}
