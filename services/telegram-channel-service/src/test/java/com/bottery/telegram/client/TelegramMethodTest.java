package com.bottery.telegram.client;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TelegramMethodTest {

  @ParameterizedTest
  @CsvSource({
    "delete_webhook, deleteWebhook",
    "send_message, sendMessage",
    "set_webhook, setWebhook",
    "get_updates, getUpdates",
    "GET_UPDATES, getUpdates",
    "answer_callback_query, answerCallbackQuery",
    "close, close"
  })
  void mixedCase_convertsSnakeCase(String input, String expected) {
    assertThat(TelegramMethod.mixedCase(input)).isEqualTo(expected);
  }

  @Test
  void fromOperation_knowsOnlyTheAllowList() {
    assertThat(TelegramMethod.fromOperation("send_message")).contains(TelegramMethod.SEND_MESSAGE);
    assertThat(TelegramMethod.fromOperation("sendMessage")).isEmpty();
    assertThat(TelegramMethod.fromOperation("delete_message")).isEmpty();
    assertThat(TelegramMethod.fromOperation(null)).isEmpty();
  }
}
