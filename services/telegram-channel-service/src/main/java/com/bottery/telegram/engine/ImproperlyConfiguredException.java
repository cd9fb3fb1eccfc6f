package com.bottery.telegram.engine;

/** Settings that make it impossible to start the engine. */
public class ImproperlyConfiguredException extends RuntimeException {
  public ImproperlyConfiguredException(String message) {
    super(message);
  }
}
