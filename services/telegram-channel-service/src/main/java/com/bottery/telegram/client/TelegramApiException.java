package com.bottery.telegram.client;

public class TelegramApiException extends RuntimeException {
  public TelegramApiException(String message) {
    super(message);
  }

  public TelegramApiException(String message, Throwable cause) {
    super(message, cause);
  }
}
