package com.acme.chat.core;

/** Malformed caller input. Always raised before any store access. */
public class InvalidArgumentException extends RuntimeException {
  public InvalidArgumentException(String message) {
    super(message);
  }

  public InvalidArgumentException(String message, Throwable e) {
    super(message, e);
  }
}
