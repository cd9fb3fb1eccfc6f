package com.bottery.telegram.model;

import com.bottery.telegram.translate.MalformedUpdateException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Telegram sender, built from the {@code from} object of a message.
 *
 * @see <a href="https://core.telegram.org/bots/api#user">Bot API: User</a>
 */
public record TelegramUser(
    long id, String firstName, String lastName, String username, String language)
    implements ChatUser {

  public static TelegramUser from(JsonNode sender) {
    JsonNode id = sender.path("id");
    if (!id.canConvertToLong()) {
      throw new MalformedUpdateException("Telegram user without id");
    }
    JsonNode firstName = sender.path("first_name");
    if (!firstName.isTextual()) {
      throw new MalformedUpdateException("Telegram user " + id.asLong() + " without first_name");
    }
    return new TelegramUser(
        id.asLong(),
        firstName.asText(),
        optionalText(sender, "last_name"),
        optionalText(sender, "username"),
        optionalText(sender, "language_code"));
  }

  private static String optionalText(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isTextual() ? value.asText() : null;
  }

  /** {@code "First Last (id)"}, or {@code "First (id)"} without a last name. */
  @Override
  public String toString() {
    StringBuilder s = new StringBuilder(firstName);
    if (lastName != null && !lastName.isBlank()) {
      s.append(' ').append(lastName);
    }
    return s.append(" (").append(id).append(')').toString();
  }
}
