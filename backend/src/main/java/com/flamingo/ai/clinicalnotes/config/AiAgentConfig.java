package com.flamingo.ai.clinicalnotes.config;

import com.flamingo.ai.clinicalnotes.agent.NoteRegenerationAgent;
import com.flamingo.ai.clinicalnotes.service.generation.AgentGenerationGateway;
import com.flamingo.ai.clinicalnotes.service.generation.GatewayPair;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the note regeneration agents and the provider pair used by merges.
 *
 * <p>Pattern: one agent interface, one AiServices implementation per provider, each wrapped in a
 * gateway guarded by its own circuit breaker.
 */
@Configuration
public class AiAgentConfig {

  static final String PRIMARY_CIRCUIT_BREAKER = "primary-provider";
  static final String FALLBACK_CIRCUIT_BREAKER = "fallback-provider";

  @Value("${langchain4j.providers.primary.id:openai}")
  private String primaryProviderId;

  @Value("${langchain4j.providers.fallback.id:gemini}")
  private String fallbackProviderId;

  /** Regeneration agent on the primary provider. */
  @Bean
  public NoteRegenerationAgent primaryNoteRegenerationAgent(
      @Qualifier("primaryChatModel") ChatModel primaryChatModel) {
    return AiServices.builder(NoteRegenerationAgent.class).chatModel(primaryChatModel).build();
  }

  /** Regeneration agent on the fallback provider. */
  @Bean
  public NoteRegenerationAgent fallbackNoteRegenerationAgent(
      @Qualifier("fallbackChatModel") ChatModel fallbackChatModel) {
    return AiServices.builder(NoteRegenerationAgent.class).chatModel(fallbackChatModel).build();
  }

  @Bean
  public GatewayPair gatewayPair(
      @Qualifier("primaryNoteRegenerationAgent") NoteRegenerationAgent primaryAgent,
      @Qualifier("fallbackNoteRegenerationAgent") NoteRegenerationAgent fallbackAgent,
      CircuitBreakerRegistry circuitBreakerRegistry) {
    return new GatewayPair(
        new AgentGenerationGateway(
            primaryProviderId,
            primaryAgent,
            circuitBreakerRegistry.circuitBreaker(PRIMARY_CIRCUIT_BREAKER)),
        new AgentGenerationGateway(
            fallbackProviderId,
            fallbackAgent,
            circuitBreakerRegistry.circuitBreaker(FALLBACK_CIRCUIT_BREAKER)));
  }
}
