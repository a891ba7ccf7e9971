package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.core.ActivityTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Bounds the execution time of the wrapped function. The function runs on an executor under a child
 * context whose deadline is the configured timeout.
 *
 * <p>Cancellation is weak: when the deadline wins, the child context is marked done and the caller
 * gets an {@link ActivityTimeoutException} right away, but the running work is neither interrupted
 * nor awaited. Work that ignores its context runs to completion and its result is discarded.
 */
public class TimeoutMiddleware implements ActivityMiddleware {
  private static final Logger LOG = LoggerFactory.getLogger(TimeoutMiddleware.class);

  public static final String ACTIVITY_TIMEOUT = "ACTIVITY_TIMEOUT";

  private static final ExecutorService DEFAULT_EXECUTOR =
      Executors.newCachedThreadPool(
          new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable r) {
              Thread t = new Thread(r, "activity-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            }
          });

  private final Duration timeout;
  private final Executor executor;

  public TimeoutMiddleware(Duration timeout) {
    this(timeout, DEFAULT_EXECUTOR);
  }

  public TimeoutMiddleware(Duration timeout, Executor executor) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive, was " + timeout);
    }
    this.timeout = timeout;
    this.executor = executor;
  }

  public Duration getTimeout() {
    return timeout;
  }

  @Override
  public ActivityFunction wrap(ActivityFunction next) {
    return (context, input) -> {
      ActivityContext child = context.withTimeout(timeout);
      Map<String, String> mdc = MDC.getCopyOfContextMap();
      CompletableFuture<byte[]> work =
          CompletableFuture.supplyAsync(
              () -> runWithMdc(mdc, () -> next.execute(child, input)), executor);

      CompletableFuture.anyOf(work.handle((result, error) -> null), child.done()).join();

      if (work.isDone()) {
        child.cancel();
        return resultOf(work);
      }
      if (context.isCancelled()) {
        throw new CancellationException("activity cancelled: " + context.getActivityName());
      }
      LOG.warn(
          "Activity {} exceeded timeout of {} ms", context.getActivityName(), timeout.toMillis());
      throw new ActivityTimeoutException(
          ACTIVITY_TIMEOUT,
          "activity execution exceeded timeout of " + timeout.toMillis() + " ms");
    };
  }

  private static byte[] runWithMdc(
      Map<String, String> mdc, Supplier<byte[]> body) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    try {
      return body.get();
    } finally {
      if (previous != null) {
        MDC.setContextMap(previous);
      } else {
        MDC.clear();
      }
    }
  }

  private static byte[] resultOf(CompletableFuture<byte[]> work) {
    try {
      return work.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }
}
