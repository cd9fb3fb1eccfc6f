package com.bottery.telegram.api;

import com.bottery.telegram.client.TelegramApiException;
import com.bottery.telegram.translate.MalformedUpdateException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  // 200: Telegram redelivers updates answered with an error status
  @ExceptionHandler(MalformedUpdateException.class)
  public ResponseEntity<Void> handleMalformedUpdate(MalformedUpdateException ex) {
    log.warn("Unprocessable Telegram update: {}", ex.getMessage());
    return ResponseEntity.ok().build();
  }

  @ExceptionHandler(TelegramApiException.class)
  public ResponseEntity<Map<String, Object>> handleTelegramApiException(TelegramApiException ex) {
    log.error("Telegram Bot API error", ex);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "TELEGRAM_API_ERROR", "message", ex.getMessage()));
  }
}
