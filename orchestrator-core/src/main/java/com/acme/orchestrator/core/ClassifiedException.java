package com.acme.orchestrator.core;

import java.util.Objects;

/**
 * Base type for every failure the pipeline surfaces to its caller. The kind is fixed by the
 * concrete subclass and never changes; the original cause stays reachable through {@link
 * #getCause()}.
 *
 * <p>The message is rendered as {@code CODE: detail} so the leading token of the serialized error
 * is always its stable code.
 */
public abstract class ClassifiedException extends RuntimeException {

  private final ErrorKind kind;
  private final String code;
  private final String detail;

  protected ClassifiedException(ErrorKind kind, String code, String detail, Throwable cause) {
    super(Objects.requireNonNull(code, "code") + ": " + detail, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.code = code;
    this.detail = detail;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getCode() {
    return code;
  }

  public String getDetail() {
    return detail;
  }

  public boolean isTransient() {
    return kind == ErrorKind.TRANSIENT;
  }

  public boolean isPermanent() {
    return kind == ErrorKind.PERMANENT;
  }

  public boolean isTimeout() {
    return kind == ErrorKind.TIMEOUT;
  }
}
