package com.flamingo.ai.clinicalnotes;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.clinicalnotes.service.compliance.EmrProfileRegistry;
import com.flamingo.ai.clinicalnotes.service.generation.GatewayPair;
import com.flamingo.ai.clinicalnotes.service.merge.SelectiveUpdateService;
import com.flamingo.ai.clinicalnotes.service.note.NoteService;
import com.flamingo.ai.clinicalnotes.service.parsing.SectionParser;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. Uses @MockitoBean
 * to mock both chat models so the test can run without provider API keys.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean(name = "primaryChatModel")
  private ChatModel primaryChatModel;

  @MockitoBean(name = "fallbackChatModel")
  private ChatModel fallbackChatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(NoteService.class)).isNotNull();
    assertThat(applicationContext.getBean(SelectiveUpdateService.class)).isNotNull();
    assertThat(applicationContext.getBean(SectionParser.class)).isNotNull();
    assertThat(applicationContext.getBean(GatewayPair.class)).isNotNull();
  }

  @Test
  @DisplayName("Profile catalog should load with the configured default")
  void profileCatalogShouldLoad() {
    EmrProfileRegistry registry = applicationContext.getBean(EmrProfileRegistry.class);

    assertThat(registry.all()).hasSize(3);
    assertThat(registry.defaultProfile().id()).isEqualTo("credible");
  }
}
