package com.flamingo.ai.reportingest.service.ingestion;

import com.flamingo.ai.reportingest.config.IngestConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs calls to external collaborators (OCR, chart classifier, describer, digitizer) under a time
 * limit. A timeout or error yields the caller's fallback value and is logged and counted; it never
 * propagates.
 */
@Component
@Slf4j
public class CollaboratorInvoker {

  static final String FAILURE_METRIC = "ingest.collaborator.failure";

  private final TimeLimiter timeLimiter;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public CollaboratorInvoker(
      IngestConfig ingestConfig,
      @Qualifier("collaboratorExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.timeLimiter =
        TimeLimiter.of(
            "collaborators",
            TimeLimiterConfig.custom()
                .timeoutDuration(ingestConfig.getCollaborators().getTimeout())
                .cancelRunningFuture(true)
                .build());
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Invokes a collaborator.
   *
   * @param collaborator name used in logs and the failure metric tag
   * @param call the collaborator call
   * @param fallback returned on timeout, error or a null result
   * @return the call's result or {@code fallback}
   */
  public <T> T invoke(String collaborator, Supplier<T> call, T fallback) {
    try {
      T result =
          timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
      return result != null ? result : fallback;
    } catch (TimeoutException e) {
      log.warn(
          "Collaborator '{}' timed out after {}",
          collaborator,
          timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
      recordFailure(collaborator);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Collaborator '{}' interrupted", collaborator);
      recordFailure(collaborator);
    } catch (Exception e) {
      log.warn("Collaborator '{}' failed: {}", collaborator, e.getMessage());
      recordFailure(collaborator);
    }
    return fallback;
  }

  private void recordFailure(String collaborator) {
    meterRegistry.counter(FAILURE_METRIC, "collaborator", collaborator).increment();
  }
}
