package com.acme.orchestrator.core;

public class ActivityTimeoutException extends ClassifiedException {
  public ActivityTimeoutException(String code, String message) {
    super(ErrorKind.TIMEOUT, code, message, null);
  }
}
