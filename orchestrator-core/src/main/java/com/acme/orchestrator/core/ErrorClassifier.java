package com.acme.orchestrator.core;

/**
 * Maps arbitrary failures onto the {@link ErrorKind} taxonomy. Already classified failures keep
 * their kind; anything else is treated as permanent.
 */
public final class ErrorClassifier {

  public static final String UNCLASSIFIED = "UNCLASSIFIED";

  private ErrorClassifier() {
    // Utility class - no instantiation
  }

  public static ErrorKind kindOf(Throwable error) {
    if (error instanceof ClassifiedException classified) {
      return classified.getKind();
    }
    return ErrorKind.PERMANENT;
  }

  public static ClassifiedException classify(Throwable error) {
    if (error instanceof ClassifiedException classified) {
      return classified;
    }
    String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    return new PermanentException(UNCLASSIFIED, message, error);
  }
}
