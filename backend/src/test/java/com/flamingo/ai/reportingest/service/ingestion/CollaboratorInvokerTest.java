package com.flamingo.ai.reportingest.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reportingest.config.IngestConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CollaboratorInvoker Tests")
class CollaboratorInvokerTest {

  private ExecutorService executor;
  private SimpleMeterRegistry meterRegistry;
  private CollaboratorInvoker invoker;

  @BeforeEach
  void setUp() {
    IngestConfig ingestConfig = new IngestConfig();
    ingestConfig.getCollaborators().setTimeout(Duration.ofMillis(200));
    executor = Executors.newSingleThreadExecutor();
    meterRegistry = new SimpleMeterRegistry();
    invoker = new CollaboratorInvoker(ingestConfig, executor, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldReturnResult_whenCallCompletesInTime() {
    assertThat(invoker.invoke("ocr", () -> List.of("word"), List.of())).containsExactly("word");
    assertThat(failures("ocr")).isZero();
  }

  @Test
  @DisplayName("Should return fallback and count a failure on timeout")
  void shouldReturnFallback_onTimeout() {
    String result =
        invoker.invoke(
            "describer",
            () -> {
              try {
                Thread.sleep(5_000);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return "late";
            },
            "");

    assertThat(result).isEmpty();
    assertThat(failures("describer")).isEqualTo(1.0);
  }

  @Test
  void shouldReturnFallback_onError() {
    String result =
        invoker.invoke(
            "classifier",
            () -> {
              throw new IllegalStateException("model missing");
            },
            "UNKNOWN");

    assertThat(result).isEqualTo("UNKNOWN");
    assertThat(failures("classifier")).isEqualTo(1.0);
  }

  @Test
  void shouldReturnFallback_forNullResult() {
    assertThat(invoker.invoke("digitizer", () -> null, "none")).isEqualTo("none");
    assertThat(failures("digitizer")).isZero();
  }

  private double failures(String collaborator) {
    return meterRegistry
        .counter(CollaboratorInvoker.FAILURE_METRIC, "collaborator", collaborator)
        .count();
  }
}
