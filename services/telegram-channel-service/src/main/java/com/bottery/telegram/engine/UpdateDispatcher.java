package com.bottery.telegram.engine;

import com.bottery.telegram.client.JsonHttpResponse;
import com.bottery.telegram.client.TelegramApi;
import com.bottery.telegram.client.TelegramApiException;
import com.bottery.telegram.config.TelegramProperties;
import com.bottery.telegram.model.Message;
import com.bottery.telegram.translate.TelegramMessageTranslator;
import com.bottery.telegram.view.MessageHandler;
import com.bottery.telegram.view.ViewResolver;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs one update through translate -> resolve -> respond -> deliver.
 *
 * <p>Updates without a message and messages nobody answers are dropped without a reply. Delivery
 * is fire-and-forget: a rejected {@code sendMessage} is logged, not reported to the caller.
 */
@Component
@Slf4j
public class UpdateDispatcher {

  private final TelegramMessageTranslator translator;
  private final ViewResolver resolver;
  private final TelegramApi api;
  private final Executor handlerExecutor;
  private final String engineName;
  private final String parseMode;

  @Autowired
  public UpdateDispatcher(
      TelegramMessageTranslator translator,
      ViewResolver resolver,
      TelegramApi api,
      @Qualifier("updateHandlerExecutor") Executor handlerExecutor,
      TelegramProperties properties) {
    this(
        translator,
        resolver,
        api,
        handlerExecutor,
        properties.engineName(),
        properties.parseMode());
  }

  public UpdateDispatcher(
      TelegramMessageTranslator translator,
      ViewResolver resolver,
      TelegramApi api,
      Executor handlerExecutor,
      String engineName,
      String parseMode) {
    this.translator = translator;
    this.resolver = resolver;
    this.api = api;
    this.handlerExecutor = handlerExecutor;
    this.engineName = engineName;
    this.parseMode = parseMode;
  }

  public void dispatch(JsonNode update) {
    Optional<Message> translated = translator.translate(update);
    if (translated.isEmpty()) {
      log.debug("[{}] Update {} has no message; skipped", engineName, updateId(update));
      return;
    }
    Message message = translated.get();
    log.info("[{}] Message from {}", engineName, message.user());

    Optional<MessageHandler> view = resolver.resolve(message);
    if (view.isEmpty()) {
      return;
    }

    String response = view.get().handle(message);
    if (response == null || response.isBlank()) {
      log.debug("[{}] View returned nothing for message {}", engineName, message.id());
      return;
    }

    JsonHttpResponse delivery = api.sendMessage(message.user().id(), response, parseMode);
    reportDelivery(message, delivery);
  }

  /**
   * Handles a batch side by side and returns once every update is done. A failing update is
   * logged and does not affect the others.
   */
  public void dispatchAll(List<JsonNode> updates) {
    if (updates.isEmpty()) {
      return;
    }
    CompletableFuture<?>[] handlers =
        updates.stream()
            .map(
                update ->
                    CompletableFuture.runAsync(() -> dispatch(update), handlerExecutor)
                        .exceptionally(
                            ex -> {
                              log.error(
                                  "[{}] Failed to handle update {}",
                                  engineName,
                                  updateId(update),
                                  unwrap(ex));
                              return null;
                            }))
            .toArray(CompletableFuture[]::new);
    CompletableFuture.allOf(handlers).join();
  }

  private void reportDelivery(Message message, JsonHttpResponse delivery) {
    try {
      if (!TelegramApi.isOk(delivery.json())) {
        log.warn(
            "[{}] Reply to message {} rejected: status={} body={}",
            engineName,
            message.id(),
            delivery.statusCode(),
            delivery.body());
      }
    } catch (TelegramApiException e) {
      log.warn("[{}] Reply to message {} unverified: {}", engineName, message.id(), e.getMessage());
    }
  }

  private static String updateId(JsonNode update) {
    return update == null ? "?" : update.path("update_id").asText("?");
  }

  private static Throwable unwrap(Throwable ex) {
    return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
  }
}
