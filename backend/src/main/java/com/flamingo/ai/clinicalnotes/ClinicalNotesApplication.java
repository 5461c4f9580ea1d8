package com.flamingo.ai.clinicalnotes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Clinical note transfer-of-care service. */
@SpringBootApplication
public class ClinicalNotesApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClinicalNotesApplication.class, args);
  }
}
