package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.core.ClassifiedException;
import com.acme.orchestrator.core.ErrorClassifier;
import java.util.concurrent.CancellationException;

/**
 * Innermost stage: turns whatever the activity threw into a {@link ClassifiedException}. gRPC
 * failures are classified by status code, other raw failures become permanent. Cancellation passes
 * through untouched.
 */
public class ErrorClassificationMiddleware implements ActivityMiddleware {

  @Override
  public ActivityFunction wrap(ActivityFunction next) {
    return (context, input) -> {
      try {
        return next.execute(context, input);
      } catch (ClassifiedException | CancellationException e) {
        throw e;
      } catch (RuntimeException e) {
        throw GrpcErrorClassifier.classify(e).orElseGet(() -> ErrorClassifier.classify(e));
      }
    };
  }
}
