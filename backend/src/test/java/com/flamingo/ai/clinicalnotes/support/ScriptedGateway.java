package com.flamingo.ai.clinicalnotes.support;

import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;
import com.flamingo.ai.clinicalnotes.exception.GatewayException;
import com.flamingo.ai.clinicalnotes.service.generation.GeneratedText;
import com.flamingo.ai.clinicalnotes.service.generation.GenerationGateway;
import com.flamingo.ai.clinicalnotes.service.generation.GenerationRequest;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Stub provider answering from a script. Each call consumes the next scripted answer; the last
 * answer repeats once the script is exhausted.
 */
public class ScriptedGateway implements GenerationGateway {

  private final String providerId;
  private final Deque<Function<GenerationRequest, GeneratedText>> script = new ArrayDeque<>();
  private final List<GenerationRequest> requests = new CopyOnWriteArrayList<>();

  private ScriptedGateway(String providerId) {
    this.providerId = providerId;
  }

  public static ScriptedGateway named(String providerId) {
    return new ScriptedGateway(providerId);
  }

  public ScriptedGateway thenReturn(String text) {
    return thenAnswer(request -> new GeneratedText(text, providerId));
  }

  public ScriptedGateway thenFail(GatewayErrorKind kind) {
    return thenAnswer(
        request -> {
          throw new GatewayException(kind, providerId, "scripted " + kind);
        });
  }

  public ScriptedGateway thenThrow(RuntimeException error) {
    return thenAnswer(
        request -> {
          throw error;
        });
  }

  public synchronized ScriptedGateway thenAnswer(
      Function<GenerationRequest, GeneratedText> answer) {
    script.addLast(answer);
    return this;
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public GeneratedText generate(GenerationRequest request) {
    requests.add(request);
    Function<GenerationRequest, GeneratedText> answer;
    synchronized (this) {
      answer = script.size() > 1 ? script.pollFirst() : script.peekFirst();
    }
    if (answer == null) {
      throw new IllegalStateException("No answer scripted for " + providerId);
    }
    return answer.apply(request);
  }

  public int callCount() {
    return requests.size();
  }

  public List<GenerationRequest> requests() {
    return List.copyOf(requests);
  }
}
