package com.flamingo.ai.clinicalnotes.service.generation;

import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;
import com.flamingo.ai.clinicalnotes.domain.enums.MergeState;
import com.flamingo.ai.clinicalnotes.exception.GatewayException;
import com.flamingo.ai.clinicalnotes.exception.MergeCancelledException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.stereotype.Component;

/**
 * Runs gateway calls on the bounded generation executor so that a per-call timeout can be
 * enforced. Every failure surfaces as a {@link GatewayException} naming the provider.
 *
 * <p>A timed-out call is cancelled with interruption, which frees its executor thread for the
 * next provider call.
 */
@Component
@Slf4j
public class GatewayCallExecutor {

  private final AsyncTaskExecutor generationExecutor;

  public GatewayCallExecutor(@Qualifier("generationExecutor") Executor generationExecutor) {
    this.generationExecutor =
        generationExecutor instanceof AsyncTaskExecutor
            ? (AsyncTaskExecutor) generationExecutor
            : new TaskExecutorAdapter(generationExecutor);
  }

  /**
   * Calls the gateway and waits at most {@code timeout} for the result.
   *
   * @throws GatewayException if the call fails, times out or cannot be scheduled
   * @throws MergeCancelledException if the waiting thread is interrupted
   */
  public GeneratedText call(
      GenerationGateway gateway, GenerationRequest request, Duration timeout) {
    Future<GeneratedText> future;
    try {
      future = generationExecutor.submit(() -> gateway.generate(request));
    } catch (RejectedExecutionException e) {
      throw new GatewayException(
          GatewayErrorKind.PROVIDER_ERROR,
          gateway.providerId(),
          "Generation executor rejected the call",
          e);
    }

    TimeLimiter timeLimiter =
        TimeLimiter.of(
            gateway.providerId(),
            TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build());
    try {
      return timeLimiter.executeFutureSupplier(() -> future);
    } catch (TimeoutException e) {
      log.warn("Provider '{}' timed out after {} ms", gateway.providerId(), timeout.toMillis());
      throw new GatewayException(
          GatewayErrorKind.TIMEOUT,
          gateway.providerId(),
          "Provider did not respond within " + timeout.toMillis() + " ms",
          e);
    } catch (ExecutionException e) {
      throw providerFailure(gateway, e.getCause() == null ? e : e.getCause());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new MergeCancelledException(MergeState.GENERATING);
    } catch (Exception e) {
      throw providerFailure(gateway, e);
    }
  }

  private static GatewayException providerFailure(GenerationGateway gateway, Throwable cause) {
    if (cause instanceof GatewayException gatewayException) {
      return gatewayException;
    }
    return new GatewayException(
        GatewayErrorKind.PROVIDER_ERROR,
        gateway.providerId(),
        "Provider call failed: " + cause.getMessage(),
        cause);
  }
}
