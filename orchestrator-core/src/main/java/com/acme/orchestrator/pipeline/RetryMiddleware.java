package com.acme.orchestrator.pipeline;

public class RetryMiddleware implements ActivityMiddleware {
  private final RetryExecutor executor;

  public RetryMiddleware(RetryPolicy policy) {
    this.executor = new RetryExecutor(policy);
  }

  @Override
  public ActivityFunction wrap(ActivityFunction next) {
    return (context, input) -> executor.execute(context, () -> next.execute(context, input));
  }
}
