package com.acme.orchestrator.pipeline;

/** Decorates an {@link ActivityFunction} with cross-cutting behaviour. */
@FunctionalInterface
public interface ActivityMiddleware {
  ActivityFunction wrap(ActivityFunction next);
}
