package com.acme.orchestrator.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Arrays;

/**
 * Orchestration, activity and compensation metrics. Durations are timers with fixed histogram
 * buckets, so a Prometheus registry exposes {@code activity_duration_seconds_bucket} and friends.
 */
public class MetricsCollector {

  private final Counter orchestrationStarted;
  private final Counter orchestrationCompleted;
  private final Counter orchestrationFailed;
  private final Timer orchestrationDuration;
  private final Counter activityExecutions;
  private final Counter activityErrors;
  private final Timer activityDuration;
  private final Counter compensationExecutions;
  private final Counter compensationErrors;
  private final Timer compensationDuration;

  public MetricsCollector(MeterRegistry registry) {
    orchestrationStarted =
        Counter.builder("orchestration.started")
            .description("Total number of orchestrations started")
            .register(registry);
    orchestrationCompleted =
        Counter.builder("orchestration.completed")
            .description("Total number of orchestrations completed successfully")
            .register(registry);
    orchestrationFailed =
        Counter.builder("orchestration.failed")
            .description("Total number of orchestrations failed")
            .register(registry);
    orchestrationDuration =
        Timer.builder("orchestration.duration")
            .description("Orchestration execution duration")
            .serviceLevelObjectives(seconds(0.1, 0.5, 1, 2, 5, 10, 30, 60))
            .register(registry);

    activityExecutions =
        Counter.builder("activity.executions")
            .description("Total number of activity executions")
            .register(registry);
    activityErrors =
        Counter.builder("activity.errors")
            .description("Total number of activity errors")
            .register(registry);
    activityDuration =
        Timer.builder("activity.duration")
            .description("Activity execution duration")
            .serviceLevelObjectives(seconds(0.01, 0.05, 0.1, 0.5, 1, 5, 10))
            .register(registry);

    compensationExecutions =
        Counter.builder("compensation.executions")
            .description("Total number of compensation executions")
            .register(registry);
    compensationErrors =
        Counter.builder("compensation.errors")
            .description("Total number of compensation errors")
            .register(registry);
    compensationDuration =
        Timer.builder("compensation.duration")
            .description("Compensation execution duration")
            .serviceLevelObjectives(seconds(0.01, 0.05, 0.1, 0.5, 1, 5))
            .register(registry);
  }

  public void recordOrchestrationStart() {
    orchestrationStarted.increment();
  }

  public void recordOrchestrationCompleted(Duration duration) {
    orchestrationCompleted.increment();
    orchestrationDuration.record(duration);
  }

  public void recordOrchestrationFailed(Duration duration) {
    orchestrationFailed.increment();
    orchestrationDuration.record(duration);
  }

  public void recordActivityExecution(Duration duration, boolean failed) {
    activityExecutions.increment();
    activityDuration.record(duration);
    if (failed) {
      activityErrors.increment();
    }
  }

  public void recordCompensation(Duration duration, boolean failed) {
    compensationExecutions.increment();
    compensationDuration.record(duration);
    if (failed) {
      compensationErrors.increment();
    }
  }

  private static Duration[] seconds(double... buckets) {
    return Arrays.stream(buckets)
        .mapToObj(s -> Duration.ofNanos(Math.round(s * 1_000_000_000L)))
        .toArray(Duration[]::new);
  }
}
