package com.bottery.telegram.translate;

import com.bottery.telegram.model.Message;
import com.bottery.telegram.model.TelegramUser;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Converts a raw Bot API update into a {@link Message}.
 *
 * <p>Only {@code message} updates carry something to answer; any other kind ({@code
 * edited_message}, {@code callback_query}, ...) and an empty {@code message} object yield an empty
 * result.
 *
 * @see <a href="https://core.telegram.org/bots/api#update">Bot API: Update</a>
 */
@Component
public class TelegramMessageTranslator {

  public static final String PLATFORM = "telegram";

  public Optional<Message> translate(JsonNode update) {
    JsonNode message = update == null ? null : update.path("message");
    if (message == null || !message.isObject() || message.isEmpty()) {
      return Optional.empty();
    }

    JsonNode text = message.path("text");
    if (!text.isTextual()) {
      throw new MalformedUpdateException(
          "Message " + message.path("message_id").asText("?") + " has no text");
    }

    return Optional.of(
        new Message(
            message.path("message_id").asLong(),
            PLATFORM,
            text.asText(),
            TelegramUser.from(message.path("from")),
            message.path("date").asLong(),
            update));
  }
}
