package com.bottery.telegram.translate;

/** The update has a message, but not in the shape the adapter can handle. */
public class MalformedUpdateException extends RuntimeException {
  public MalformedUpdateException(String message) {
    super(message);
  }
}
