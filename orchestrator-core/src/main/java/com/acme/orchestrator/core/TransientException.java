package com.acme.orchestrator.core;

public class TransientException extends ClassifiedException {
  public TransientException(String code, String message) {
    super(ErrorKind.TRANSIENT, code, message, null);
  }

  public TransientException(String code, String message, Throwable e) {
    super(ErrorKind.TRANSIENT, code, message, e);
  }
}
