package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.core.TraceIds;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Per-invocation context: identifiers used for log correlation plus a cancellation signal. A child
 * created with {@link #withTimeout(Duration)} is done when its parent is done or when its deadline
 * passes, whichever comes first.
 *
 * <p>Cancellation is cooperative. Work running under a context should check {@link #isCancelled()}
 * or wait through {@link #awaitCancellation(Duration)} instead of sleeping.
 *
 * <p>A child detaches from its parent once it is done, so a long-lived parent only holds on to
 * children that are still running.
 */
public final class ActivityContext {

  private final String activityName;
  private final String traceId;
  private final String orchestrationId;
  private final Signal signal;

  private ActivityContext(
      String activityName, String traceId, String orchestrationId, Signal signal) {
    this.activityName = Objects.requireNonNull(activityName, "activityName");
    this.traceId = traceId == null || traceId.isBlank() ? TraceIds.generate() : traceId;
    this.orchestrationId = orchestrationId;
    this.signal = signal;
  }

  /** Root context with a freshly generated trace id. */
  public static ActivityContext create(String activityName) {
    return new ActivityContext(activityName, null, null, new Signal());
  }

  /** Root context. A null or blank trace id is replaced by a generated one. */
  public static ActivityContext create(
      String activityName, String traceId, String orchestrationId) {
    return new ActivityContext(activityName, traceId, orchestrationId, new Signal());
  }

  public String getActivityName() {
    return activityName;
  }

  public String getTraceId() {
    return traceId;
  }

  public String getOrchestrationId() {
    return orchestrationId;
  }

  /** Same identifiers, different activity name; shares this context's cancellation signal. */
  public ActivityContext forActivity(String name) {
    return new ActivityContext(name, traceId, orchestrationId, signal);
  }

  /** Child context that is cancelled by this context or automatically after {@code timeout}. */
  public ActivityContext withTimeout(Duration timeout) {
    Signal child = new Signal();
    signal.children.add(child);
    child.done.whenComplete((v, e) -> signal.children.remove(child));
    if (signal.done.isDone()) {
      child.done.complete(null);
    }
    child.done.completeOnTimeout(null, timeout.toNanos(), TimeUnit.NANOSECONDS);
    return new ActivityContext(activityName, traceId, orchestrationId, child);
  }

  /** Signals cancellation to this context and all of its children. */
  public void cancel() {
    signal.done.complete(null);
  }

  public boolean isCancelled() {
    return signal.done.isDone();
  }

  /**
   * Blocks until this context is cancelled or {@code timeout} elapses.
   *
   * @return true if the context was cancelled, false if the wait simply timed out
   */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    if (timeout.isZero() || timeout.isNegative()) {
      return isCancelled();
    }
    try {
      signal.done.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      return true; // done is only ever completed normally
    }
  }

  CompletableFuture<Void> done() {
    return signal.done;
  }

  int runningChildren() {
    return signal.children.size();
  }

  /** Cancellation signal shared by contexts of the same invocation. */
  private static final class Signal {
    final CompletableFuture<Void> done = new CompletableFuture<>();
    final Set<Signal> children = ConcurrentHashMap.newKeySet();

    Signal() {
      done.whenComplete((v, e) -> children.forEach(child -> child.done.complete(null)));
    }
  }
}
