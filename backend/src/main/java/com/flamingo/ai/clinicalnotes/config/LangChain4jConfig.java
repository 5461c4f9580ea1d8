package com.flamingo.ai.clinicalnotes.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j chat models.
 *
 * <p>The fallback provider is any OpenAI-compatible endpoint, selected by its base URL.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.providers.primary.api-key:}")
  private String primaryApiKey;

  @Value("${langchain4j.providers.primary.base-url:https://api.openai.com/v1}")
  private String primaryBaseUrl;

  @Value("${langchain4j.providers.primary.model-name:gpt-5-mini}")
  private String primaryModelName;

  @Value("${langchain4j.providers.fallback.api-key:}")
  private String fallbackApiKey;

  @Value(
      "${langchain4j.providers.fallback.base-url:"
          + "https://generativelanguage.googleapis.com/v1beta/openai/}")
  private String fallbackBaseUrl;

  @Value("${langchain4j.providers.fallback.model-name:gemini-2.5-flash}")
  private String fallbackModelName;

  @Value("${langchain4j.providers.max-completion-tokens:4096}")
  private int maxCompletionTokens;

  @Value("${langchain4j.providers.timeout:PT90S}")
  private Duration timeout;

  @Bean
  public ChatModel primaryChatModel() {
    validateApiKey(primaryApiKey, "primary", "PRIMARY_LLM_API_KEY");

    return OpenAiChatModel.builder()
        .baseUrl(primaryBaseUrl)
        .apiKey(primaryApiKey)
        .modelName(primaryModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(timeout)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public ChatModel fallbackChatModel() {
    validateApiKey(fallbackApiKey, "fallback", "FALLBACK_LLM_API_KEY");

    return OpenAiChatModel.builder()
        .baseUrl(fallbackBaseUrl)
        .apiKey(fallbackApiKey)
        .modelName(fallbackModelName)
        .maxTokens(maxCompletionTokens)
        .timeout(timeout)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey(String apiKey, String provider, String variable) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "API key for the " + provider + " provider is required. Set " + variable + ".");
    }
  }
}
