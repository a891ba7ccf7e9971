package com.acme.orchestrator.logging;

import static org.assertj.core.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.spi.FilterReply;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.MDC;

class ThreadIdTurboFilterTest {

  private final ThreadIdTurboFilter filter = new ThreadIdTurboFilter();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  @DisplayName("decide - should stay neutral and tag the calling thread")
  void testDecide() throws Exception {
    AtomicReference<String> threadId = new AtomicReference<>();
    AtomicReference<String> component = new AtomicReference<>();
    AtomicReference<FilterReply> reply = new AtomicReference<>();
    Thread thread =
        new Thread(
            () -> {
              reply.set(
                  filter.decide(
                      null,
                      new LoggerContext().getLogger("test"),
                      Level.INFO,
                      "msg",
                      null,
                      null));
              threadId.set(MDC.get(ThreadIdTurboFilter.THREAD_ID_KEY));
              component.set(MDC.get(ThreadIdTurboFilter.COMPONENT_KEY));
            },
            "logs-flusher");
    thread.start();
    thread.join();

    assertThat(reply.get()).isEqualTo(FilterReply.NEUTRAL);
    assertThat(threadId.get()).isEqualTo(Long.toString(thread.getId()));
    assertThat(component.get()).isEqualTo("flusher");
  }

  @ParameterizedTest
  @CsvSource({
    "task_events-flusher, flusher",
    "grpc-default-executor-0, otlp",
    "scheduled-executor-thread-1, scheduler",
    "default-nioEventLoopGroup-1-2, http",
    "main, worker"
  })
  @DisplayName("componentOf - should map thread names to worker components")
  void testComponentOf(String threadName, String component) {
    assertThat(ThreadIdTurboFilter.componentOf(threadName)).isEqualTo(component);
  }
}
