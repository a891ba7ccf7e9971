package com.acme.orchestrator.core;

public class PermanentException extends ClassifiedException {
  public PermanentException(String code, String message) {
    super(ErrorKind.PERMANENT, code, message, null);
  }

  public PermanentException(String code, String message, Throwable e) {
    super(ErrorKind.PERMANENT, code, message, e);
  }
}
