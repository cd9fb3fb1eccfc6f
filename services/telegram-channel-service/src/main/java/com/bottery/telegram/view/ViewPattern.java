package com.bottery.telegram.view;

import com.bottery.telegram.model.Message;
import java.util.Objects;

/** Routes messages whose text equals {@code pattern} to {@code view}. */
public record ViewPattern(String pattern, MessageHandler view) {

  public ViewPattern {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(view, "view");
  }

  public boolean matches(Message message) {
    return message != null && pattern.equals(message.text());
  }
}
