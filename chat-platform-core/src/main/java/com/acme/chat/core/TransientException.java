package com.acme.chat.core;

/** Retryable storage failure: pool exhaustion, timeouts, connection loss, unresolved write races. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
