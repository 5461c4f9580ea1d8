package com.flamingo.ai.clinicalnotes.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.clinicalnotes.agent.NoteRegenerationAgent;
import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.OngoingStubbing;

@ExtendWith(MockitoExtension.class)
@DisplayName("AgentGenerationGateway Tests")
class AgentGenerationGatewayTest {

  @Mock private NoteRegenerationAgent agent;

  private CircuitBreaker circuitBreaker;
  private AgentGenerationGateway gateway;

  private final GenerationRequest request =
      new GenerationRequest(
          "HPI:\nLow mood.\n\nPlan:\nContinue.",
          "Mood better.",
          List.of(SectionType.PLAN),
          "credible",
          List.of("smart-phrase", "dot-phrase"),
          false,
          List.of());

  @BeforeEach
  void setUp() {
    circuitBreaker = CircuitBreaker.ofDefaults("primary-provider");
    gateway = new AgentGenerationGateway("openai", agent, circuitBreaker);
  }

  private OngoingStubbing<String> whenRegenerating() {
    return when(
        agent.regenerate(
            anyString(), anyString(), anyString(), anyString(), anyString(), anyString()));
  }

  @Test
  @DisplayName("should return the agent text tagged with the provider id")
  void shouldReturnText_whenAgentAnswers() {
    when(agent.regenerate(
            eq("credible"),
            eq("smart-phrase, dot-phrase"),
            eq("Plan (PLAN)"),
            eq(""),
            eq("HPI:\nLow mood.\n\nPlan:\nContinue."),
            eq("Mood better.")))
        .thenReturn("Plan:\nIncrease dose.");

    GeneratedText text = gateway.generate(request);

    assertThat(text.text()).isEqualTo("Plan:\nIncrease dose.");
    assertThat(text.providerId()).isEqualTo("openai");
  }

  @Test
  @DisplayName("should pass strict instructions listing the violations to avoid")
  void shouldPassStrictInstructions_whenRetrying() {
    whenRegenerating()
        .thenReturn("Plan:\nIncrease dose.");

    gateway.generate(
        request.strictRetry(
            List.of(SectionType.PLAN), List.of("forbidden token 'smart-phrase' found 1 time")));

    ArgumentCaptor<String> strict = ArgumentCaptor.forClass(String.class);
    verify(agent)
        .regenerate(
            anyString(), anyString(), anyString(), strict.capture(), anyString(), anyString());
    assertThat(strict.getValue())
        .startsWith("STRICT MODE")
        .contains("- Avoid: forbidden token 'smart-phrase' found 1 time");
  }

  @Test
  @DisplayName("should report blank agent output as an empty response")
  void shouldThrowEmptyResponse_whenBlank() {
    whenRegenerating()
        .thenReturn("  ");

    assertThatThrownBy(() -> gateway.generate(request))
        .isInstanceOf(GatewayException.class)
        .satisfies(
            e ->
                assertThat(((GatewayException) e).getKind())
                    .isEqualTo(GatewayErrorKind.EMPTY_RESPONSE));
  }

  @Test
  @DisplayName("should classify failures caused by socket timeouts as timeouts")
  void shouldThrowTimeout_whenCausedBySocketTimeout() {
    whenRegenerating()
        .thenThrow(new RuntimeException("I/O error", new SocketTimeoutException("read timed out")));

    assertThatThrownBy(() -> gateway.generate(request))
        .isInstanceOf(GatewayException.class)
        .satisfies(
            e -> {
              GatewayException error = (GatewayException) e;
              assertThat(error.getKind()).isEqualTo(GatewayErrorKind.TIMEOUT);
              assertThat(error.getProviderId()).isEqualTo("openai");
            });
  }

  @Test
  @DisplayName("should classify other agent failures as provider errors")
  void shouldThrowProviderError_whenAgentFails() {
    whenRegenerating()
        .thenThrow(new IllegalStateException("HTTP 500"));

    assertThatThrownBy(() -> gateway.generate(request))
        .isInstanceOf(GatewayException.class)
        .hasMessageContaining("HTTP 500")
        .satisfies(
            e ->
                assertThat(((GatewayException) e).getKind())
                    .isEqualTo(GatewayErrorKind.PROVIDER_ERROR));
  }

  @Test
  @DisplayName("should fail fast without calling the agent when the circuit is open")
  void shouldFailFast_whenCircuitOpen() {
    circuitBreaker.transitionToOpenState();

    assertThatThrownBy(() -> gateway.generate(request))
        .isInstanceOf(GatewayException.class)
        .hasMessageContaining("Circuit breaker 'primary-provider' is open");
    verify(agent, never())
        .regenerate(anyString(), anyString(), anyString(), anyString(), anyString(), anyString());
  }

  @Test
  @DisplayName("should describe an empty rule list as none")
  void shouldDescribeNoRules_whenProfileAllowsEverything() {
    GenerationRequest epicRequest =
        new GenerationRequest(
            "Plan:\nContinue.", "", List.of(SectionType.PLAN), "epic", List.of(), false, null);
    when(agent.regenerate(
            eq("epic"), eq("none"), anyString(), anyString(), anyString(), anyString()))
        .thenReturn("Plan:\nContinue.");

    assertThat(gateway.generate(epicRequest).text()).isEqualTo("Plan:\nContinue.");
  }
}
