package com.bottery.telegram.api;

import com.bottery.telegram.engine.UpdateDispatcher;
import com.bottery.telegram.engine.WebhookModeCondition;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Conditional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook endpoint Telegram pushes updates to. Only registered when the engine selects {@link
 * com.bottery.telegram.engine.EngineMode#WEBHOOK}.
 *
 * <p>Answers with an empty 200 whether or not a reply was sent.
 */
@RestController
@Slf4j
@Conditional(WebhookModeCondition.class)
public class TelegramWebhookController {

  static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

  private final UpdateDispatcher dispatcher;
  private final String secretToken;

  public TelegramWebhookController(
      UpdateDispatcher dispatcher,
      @Value("${bottery.telegram.webhook.secret-token:}") String secretToken) {
    this.dispatcher = dispatcher;
    this.secretToken = secretToken == null ? "" : secretToken.trim();
  }

  @PostMapping("/")
  public ResponseEntity<Void> webhook(
      @RequestBody JsonNode update,
      @RequestHeader(value = SECRET_HEADER, required = false) String headerSecret) {
    if (!secretToken.isBlank() && !secretToken.equals(headerSecret)) {
      log.warn("Webhook secret token mismatch");
      return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }

    dispatcher.dispatch(update);
    return ResponseEntity.ok().build();
  }
}
