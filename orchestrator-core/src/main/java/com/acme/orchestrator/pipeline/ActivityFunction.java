package com.acme.orchestrator.pipeline;

/**
 * A unit of work invoked by the workflow engine: opaque bytes in, opaque bytes out. Failures are
 * thrown as unchecked exceptions, ideally {@link com.acme.orchestrator.core.ClassifiedException}s.
 */
@FunctionalInterface
public interface ActivityFunction {
  byte[] execute(ActivityContext context, byte[] input);
}
