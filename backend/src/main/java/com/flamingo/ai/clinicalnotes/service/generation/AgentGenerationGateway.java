package com.flamingo.ai.clinicalnotes.service.generation;

import com.flamingo.ai.clinicalnotes.agent.NoteRegenerationAgent;
import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/** {@link GenerationGateway} backed by a LangChain4j {@link NoteRegenerationAgent}. */
@Slf4j
public class AgentGenerationGateway implements GenerationGateway {

  private final String providerId;
  private final NoteRegenerationAgent agent;
  private final CircuitBreaker circuitBreaker;

  public AgentGenerationGateway(
      String providerId, NoteRegenerationAgent agent, CircuitBreaker circuitBreaker) {
    this.providerId = providerId;
    this.agent = agent;
    this.circuitBreaker = circuitBreaker;
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public GeneratedText generate(GenerationRequest request) {
    String text;
    try {
      text = circuitBreaker.executeSupplier(() -> callAgent(request));
    } catch (CallNotPermittedException e) {
      throw new GatewayException(
          GatewayErrorKind.PROVIDER_ERROR,
          providerId,
          "Circuit breaker '" + circuitBreaker.getName() + "' is open",
          e);
    } catch (RuntimeException e) {
      GatewayErrorKind kind =
          isTimeout(e) ? GatewayErrorKind.TIMEOUT : GatewayErrorKind.PROVIDER_ERROR;
      log.warn("Provider '{}' failed ({}): {}", providerId, kind, e.getMessage());
      throw new GatewayException(kind, providerId, "Provider call failed: " + e.getMessage(), e);
    }

    if (text == null || text.isBlank()) {
      throw new GatewayException(
          GatewayErrorKind.EMPTY_RESPONSE, providerId, "Provider returned an empty note");
    }
    return new GeneratedText(text, providerId);
  }

  private String callAgent(GenerationRequest request) {
    log.debug(
        "Calling provider '{}' (strict={}, sections={})",
        providerId,
        request.strict(),
        request.allowedSectionTypes());
    return agent.regenerate(
        request.complianceProfileId(),
        request.complianceRules().isEmpty()
            ? "none"
            : String.join(", ", request.complianceRules()),
        describeSections(request.allowedSectionTypes()),
        strictInstructions(request),
        request.fullContextText(),
        request.transcriptText() == null ? "" : request.transcriptText());
  }

  private static String describeSections(List<SectionType> types) {
    if (types.isEmpty()) {
      return "none";
    }
    return types.stream()
        .map(type -> type.getDisplayTitle() + " (" + type.name() + ")")
        .collect(Collectors.joining(", "));
  }

  private static String strictInstructions(GenerationRequest request) {
    if (!request.strict()) {
      return "";
    }
    StringBuilder instructions =
        new StringBuilder(
            "STRICT MODE: the previous attempt was rejected by the EMR compliance check. "
                + "Output plain text only and keep every required section heading.");
    for (String violation : request.violationsToAvoid()) {
      instructions.append("\n- Avoid: ").append(violation);
    }
    return instructions.toString();
  }

  private static boolean isTimeout(Throwable error) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (cause instanceof TimeoutException
          || cause instanceof SocketTimeoutException
          || cause instanceof HttpTimeoutException) {
        return true;
      }
      if (cause.getCause() == cause) {
        break;
      }
    }
    return false;
  }
}
