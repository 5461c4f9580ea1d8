package com.flamingo.ai.clinicalnotes.domain.enums;

/** Overall layout family detected for a parsed note. */
public enum NoteFormat {
  /** At least three of the four SOAP headings. */
  SOAP,
  /** At least three standardized transfer-of-care sections. */
  STANDARDIZED,
  /** Both SOAP and standardized sections, below either threshold. */
  MIXED,
  UNKNOWN
}
