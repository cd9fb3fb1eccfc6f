package com.bottery.telegram.client;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Bot API operations this adapter is allowed to call. */
public enum TelegramMethod {
  DELETE_WEBHOOK("delete_webhook"),
  SEND_MESSAGE("send_message"),
  SET_WEBHOOK("set_webhook"),
  GET_UPDATES("get_updates");

  private final String operation;
  private final String endpoint;

  TelegramMethod(String operation) {
    this.operation = operation;
    this.endpoint = mixedCase(operation);
  }

  public String operation() {
    return operation;
  }

  /** Name of the Bot API endpoint, e.g. {@code getUpdates}. */
  public String endpoint() {
    return endpoint;
  }

  public static Optional<TelegramMethod> fromOperation(String operation) {
    if (operation == null) return Optional.empty();
    return Arrays.stream(values()).filter(m -> m.operation().equals(operation)).findFirst();
  }

  /**
   * {@code delete_webhook} -> {@code deleteWebhook}: first word lowercased, following words
   * title-cased.
   */
  public static String mixedCase(String value) {
    String[] words = value.split("_");
    StringBuilder out = new StringBuilder(words[0].toLowerCase(Locale.ROOT));
    for (int i = 1; i < words.length; i++) {
      out.append(titleCase(words[i]));
    }
    return out.toString();
  }

  private static String titleCase(String word) {
    if (word.isEmpty()) return word;
    return word.substring(0, 1).toUpperCase(Locale.ROOT)
        + word.substring(1).toLowerCase(Locale.ROOT);
  }
}
