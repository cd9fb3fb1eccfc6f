package com.bottery.telegram.view;

import com.bottery.telegram.model.Message;

/** Produces the reply text for a message; {@code null} or blank means "nothing to send". */
@FunctionalInterface
public interface MessageHandler {

  String handle(Message message);
}
