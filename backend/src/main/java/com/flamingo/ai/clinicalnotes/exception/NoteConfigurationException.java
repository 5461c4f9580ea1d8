package com.flamingo.ai.clinicalnotes.exception;

/** Exception thrown when a caller supplies an invalid note, profile or section selection. */
public class NoteConfigurationException extends RuntimeException {

  public NoteConfigurationException(String message) {
    super(message);
  }
}
