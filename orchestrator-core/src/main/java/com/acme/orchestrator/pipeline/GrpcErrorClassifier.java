package com.acme.orchestrator.pipeline;

import com.acme.orchestrator.core.ClassifiedException;
import com.acme.orchestrator.core.PermanentException;
import com.acme.orchestrator.core.TransientException;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies failures raised by gRPC collaborators. Codes that usually clear up on their own
 * (availability, quotas, conflicts, deadlines, internal errors) are transient; everything else is
 * permanent.
 */
public final class GrpcErrorClassifier {

  static final Set<Status.Code> TRANSIENT_CODES =
      EnumSet.of(
          Status.Code.UNAVAILABLE,
          Status.Code.RESOURCE_EXHAUSTED,
          Status.Code.FAILED_PRECONDITION,
          Status.Code.ABORTED,
          Status.Code.DEADLINE_EXCEEDED,
          Status.Code.INTERNAL,
          Status.Code.UNKNOWN);

  private static final int MAX_CAUSE_DEPTH = 32;

  private GrpcErrorClassifier() {}

  /** Status carried by the first gRPC exception in the cause chain, if any. */
  public static Optional<Status> statusOf(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof StatusRuntimeException sre) {
        return Optional.of(sre.getStatus());
      }
      if (current instanceof StatusException se) {
        return Optional.of(se.getStatus());
      }
      current = current.getCause();
    }
    return Optional.empty();
  }

  public static Optional<Status.Code> statusCodeOf(Throwable error) {
    return statusOf(error).map(Status::getCode);
  }

  public static boolean isTransientCode(Status.Code code) {
    return TRANSIENT_CODES.contains(code);
  }

  public static boolean isTransientGrpcError(Throwable error) {
    return statusCodeOf(error).map(GrpcErrorClassifier::isTransientCode).orElse(false);
  }

  /**
   * Classified form of a gRPC failure, or empty when the error carries no gRPC status. The original
   * error is kept as the cause.
   */
  public static Optional<ClassifiedException> classify(Throwable error) {
    return statusOf(error)
        .map(
            status -> {
              String code = "GRPC_" + status.getCode().name();
              String description = status.getDescription() != null ? status.getDescription() : "";
              if (isTransientCode(status.getCode())) {
                return new TransientException(
                    code, "gRPC error (transient): " + description, error);
              }
              return new PermanentException(code, "gRPC error (permanent): " + description, error);
            });
  }
}
