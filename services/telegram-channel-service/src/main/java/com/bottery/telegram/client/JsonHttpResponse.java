package com.bottery.telegram.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * An HTTP response whose body has not been decoded yet. Callers decide whether and when to read
 * it as JSON.
 */
public final class JsonHttpResponse {

  private final int statusCode;
  private final String body;
  private final ObjectMapper objectMapper;

  public JsonHttpResponse(int statusCode, String body, ObjectMapper objectMapper) {
    this.statusCode = statusCode;
    this.body = body == null ? "" : body;
    this.objectMapper = objectMapper;
  }

  public int statusCode() {
    return statusCode;
  }

  public String body() {
    return body;
  }

  public JsonNode json() {
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new TelegramApiException(
          "Telegram response is not valid JSON (status=" + statusCode + ")", e);
    }
  }
}
