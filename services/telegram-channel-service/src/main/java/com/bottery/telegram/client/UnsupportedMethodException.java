package com.bottery.telegram.client;

/** Raised for an operation name outside {@link TelegramMethod}; never reaches the network. */
public class UnsupportedMethodException extends RuntimeException {
  public UnsupportedMethodException(String operation) {
    super("Unsupported Telegram operation: " + operation);
  }
}
