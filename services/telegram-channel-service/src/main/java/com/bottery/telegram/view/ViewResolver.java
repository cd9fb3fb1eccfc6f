package com.bottery.telegram.view;

import com.bottery.telegram.model.Message;
import java.util.Optional;

/** Picks the handler that should answer a message, if any. */
public interface ViewResolver {

  Optional<MessageHandler> resolve(Message message);
}
