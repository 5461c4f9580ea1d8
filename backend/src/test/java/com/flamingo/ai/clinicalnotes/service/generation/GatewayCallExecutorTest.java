package com.flamingo.ai.clinicalnotes.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.exception.GatewayException;
import com.flamingo.ai.clinicalnotes.support.ScriptedGateway;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@DisplayName("GatewayCallExecutor Tests")
class GatewayCallExecutorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  private final GenerationRequest request =
      new GenerationRequest(
          "Plan:\nContinue.", "", List.of(SectionType.PLAN), "credible", List.of(), false, null);

  private ExecutorService executor;
  private GatewayCallExecutor callExecutor;

  @BeforeEach
  void setUp() {
    executor = Executors.newCachedThreadPool();
    callExecutor = new GatewayCallExecutor(executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("should return the gateway result")
  void shouldReturnResult() {
    ScriptedGateway gateway = ScriptedGateway.named("openai").thenReturn("Plan:\nIncrease.");

    assertThat(callExecutor.call(gateway, request, TIMEOUT).text()).isEqualTo("Plan:\nIncrease.");
  }

  @Test
  @DisplayName("should rethrow gateway exceptions unchanged")
  void shouldRethrowGatewayException() {
    ScriptedGateway gateway =
        ScriptedGateway.named("openai").thenFail(GatewayErrorKind.EMPTY_RESPONSE);

    assertThatThrownBy(() -> callExecutor.call(gateway, request, TIMEOUT))
        .isInstanceOf(GatewayException.class)
        .satisfies(
            e ->
                assertThat(((GatewayException) e).getKind())
                    .isEqualTo(GatewayErrorKind.EMPTY_RESPONSE));
  }

  @Test
  @DisplayName("should wrap other failures as provider errors")
  void shouldWrapForeignException() {
    ScriptedGateway gateway =
        ScriptedGateway.named("gemini").thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> callExecutor.call(gateway, request, TIMEOUT))
        .isInstanceOf(GatewayException.class)
        .hasMessageContaining("boom")
        .satisfies(
            e -> {
              GatewayException error = (GatewayException) e;
              assertThat(error.getKind()).isEqualTo(GatewayErrorKind.PROVIDER_ERROR);
              assertThat(error.getProviderId()).isEqualTo("gemini");
            });
  }

  @Test
  @DisplayName("should time out slow providers")
  void shouldTimeOut_whenProviderSlow() {
    ScriptedGateway gateway =
        ScriptedGateway.named("openai")
            .thenAnswer(
                r -> {
                  try {
                    Thread.sleep(5_000);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                  return new GeneratedText("late", "openai");
                });

    assertThatThrownBy(() -> callExecutor.call(gateway, request, Duration.ofMillis(50)))
        .isInstanceOf(GatewayException.class)
        .satisfies(
            e ->
                assertThat(((GatewayException) e).getKind())
                    .isEqualTo(GatewayErrorKind.TIMEOUT));
  }

  @Test
  @DisplayName("should interrupt a timed-out call so the next call gets the executor thread")
  void shouldFreeExecutorThread_whenCallTimesOut() throws InterruptedException {
    ThreadPoolTaskExecutor singleThread = new ThreadPoolTaskExecutor();
    singleThread.setCorePoolSize(1);
    singleThread.setMaxPoolSize(1);
    singleThread.setQueueCapacity(10);
    singleThread.setThreadNamePrefix("generation-test-");
    singleThread.initialize();
    try {
      GatewayCallExecutor bounded = new GatewayCallExecutor(singleThread);
      CountDownLatch interrupted = new CountDownLatch(1);
      ScriptedGateway slow =
          ScriptedGateway.named("openai")
              .thenAnswer(
                  r -> {
                    try {
                      Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                      interrupted.countDown();
                      Thread.currentThread().interrupt();
                    }
                    return new GeneratedText("late", "openai");
                  });
      ScriptedGateway quick = ScriptedGateway.named("gemini").thenReturn("Plan:\nIncrease.");

      assertThatThrownBy(() -> bounded.call(slow, request, Duration.ofMillis(300)))
          .isInstanceOf(GatewayException.class)
          .satisfies(
              e ->
                  assertThat(((GatewayException) e).getKind())
                      .isEqualTo(GatewayErrorKind.TIMEOUT));

      assertThat(bounded.call(quick, request, Duration.ofMillis(1_000)).text())
          .isEqualTo("Plan:\nIncrease.");
      assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
    } finally {
      singleThread.shutdown();
    }
  }

  @Test
  @DisplayName("should report a saturated executor as a provider error")
  void shouldReportRejection() {
    GatewayCallExecutor saturated =
        new GatewayCallExecutor(
            command -> {
              throw new RejectedExecutionException("queue full");
            });
    ScriptedGateway gateway = ScriptedGateway.named("openai").thenReturn("Plan:\nIncrease.");

    assertThatThrownBy(() -> saturated.call(gateway, request, TIMEOUT))
        .isInstanceOf(GatewayException.class)
        .hasMessageContaining("rejected");
    assertThat(gateway.callCount()).isZero();
  }
}
