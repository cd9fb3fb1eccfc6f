package com.bottery.telegram.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bottery.telegram.model.Message;
import com.bottery.telegram.model.TelegramUser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class TelegramMessageTranslatorTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final TelegramMessageTranslator translator = new TelegramMessageTranslator();

  @Test
  void translate_textMessage() throws Exception {
    JsonNode update =
        mapper.readTree(
            """
            {"update_id": 900,
             "message": {"message_id": 5, "text": "hi", "date": 1000,
                         "from": {"id": 42, "first_name": "A"}}}
            """);

    Message message = translator.translate(update).orElseThrow();

    assertThat(message.id()).isEqualTo(5);
    assertThat(message.text()).isEqualTo("hi");
    assertThat(message.timestamp()).isEqualTo(1000);
    assertThat(message.platform()).isEqualTo("telegram");
    assertThat(message.user().id()).isEqualTo(42);
    assertThat(message.raw()).isSameAs(update);
  }

  @Test
  void translate_fullSender() throws Exception {
    JsonNode update =
        mapper.readTree(
            """
            {"message": {"message_id": 7, "text": "ping", "date": 1700000000,
                         "from": {"id": 1, "first_name": "Ada", "last_name": "Lovelace",
                                  "username": "ada", "language_code": "en"}}}
            """);

    Message message = translator.translate(update).orElseThrow();

    assertThat(message.user())
        .isEqualTo(new TelegramUser(1, "Ada", "Lovelace", "ada", "en"))
        .hasToString("Ada Lovelace (1)");
  }

  @Test
  void translate_otherUpdateKindsYieldNothing() throws Exception {
    JsonNode edited =
        mapper.readTree("{\"update_id\": 1, \"edited_message\": {\"message_id\": 5}}");

    assertThat(translator.translate(edited)).isEmpty();
    assertThat(translator.translate(mapper.readTree("{\"callback_query\": {\"id\": \"c\"}}")))
        .isEmpty();
    assertThat(translator.translate(mapper.readTree("{}"))).isEmpty();
    assertThat(translator.translate(mapper.readTree("{\"message\": {}}"))).isEmpty();
    assertThat(translator.translate(mapper.readTree("{\"message\": null}"))).isEmpty();
  }

  @Test
  void translate_messageWithoutTextIsMalformed() throws Exception {
    JsonNode sticker =
        mapper.readTree(
            """
            {"message": {"message_id": 9, "date": 1, "sticker": {},
                         "from": {"id": 42, "first_name": "A"}}}
            """);

    assertThatThrownBy(() -> translator.translate(sticker))
        .isInstanceOf(MalformedUpdateException.class)
        .hasMessageContaining("9");
  }

  @Test
  void translate_senderWithoutFirstNameIsMalformed() throws Exception {
    JsonNode update =
        mapper.readTree(
            "{\"message\": {\"message_id\": 2, \"text\": \"t\", \"from\": {\"id\": 42}}}");

    assertThatThrownBy(() -> translator.translate(update))
        .isInstanceOf(MalformedUpdateException.class);
  }
}
