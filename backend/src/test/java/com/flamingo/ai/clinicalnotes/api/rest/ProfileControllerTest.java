package com.flamingo.ai.clinicalnotes.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.clinicalnotes.exception.GlobalExceptionHandler;
import com.flamingo.ai.clinicalnotes.support.TestProfiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("ProfileController Integration Tests")
class ProfileControllerTest {

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ProfileController(TestProfiles.registry()),
                new HealthController(TestProfiles.registry()))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should list every profile and flag the default")
  void shouldListProfiles() throws Exception {
    mockMvc
        .perform(get("/api/profiles"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(3))
        .andExpect(jsonPath("$[0].id").value("epic"))
        .andExpect(jsonPath("$[0].defaultProfile").value(false))
        .andExpect(jsonPath("$[1].id").value("credible"))
        .andExpect(jsonPath("$[1].defaultProfile").value(true))
        .andExpect(jsonPath("$[1].forbiddenTokenRules.length()").value(4));
  }

  @Test
  @DisplayName("Should return a single profile")
  void shouldReturnProfile() throws Exception {
    mockMvc
        .perform(get("/api/profiles/{profileId}", "credible-transfer"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.requiresCanonicalStructure").value(true))
        .andExpect(jsonPath("$.canonicalStructureSections[0]").value("HPI"))
        .andExpect(jsonPath("$.aliasTable").value("behavioral-health"));
  }

  @Test
  @DisplayName("Should return 404 for an unknown profile")
  void shouldReturnNotFound() throws Exception {
    mockMvc
        .perform(get("/api/profiles/{profileId}", "cerner"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("PROFILE_001"))
        .andExpect(jsonPath("$.message").value("EMR profile not found: cerner"));
  }

  @Test
  @DisplayName("Should report catalog statistics")
  void shouldReportStats() throws Exception {
    mockMvc
        .perform(get("/health/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.profiles").value(3))
        .andExpect(jsonPath("$.defaultProfile").value("credible"));
  }
}
