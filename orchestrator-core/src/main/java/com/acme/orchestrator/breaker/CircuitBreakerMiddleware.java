package com.acme.orchestrator.breaker;

import com.acme.orchestrator.pipeline.ActivityFunction;
import com.acme.orchestrator.pipeline.ActivityMiddleware;
import java.util.Objects;

public class CircuitBreakerMiddleware implements ActivityMiddleware {
  private final CircuitBreaker breaker;

  public CircuitBreakerMiddleware(CircuitBreaker breaker) {
    this.breaker = Objects.requireNonNull(breaker, "breaker");
  }

  @Override
  public ActivityFunction wrap(ActivityFunction next) {
    return (context, input) -> breaker.execute(() -> next.execute(context, input));
  }
}
