package com.bottery.telegram.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bot API proxy: turns an allow-listed operation name into {@code POST
 * {apiUrl}/bot{token}/{endpoint}} with the arguments as JSON body.
 *
 * <p>Responses are handed back undecoded; checking the {@code ok} flag is up to the caller.
 */
public class TelegramApi {

  private final String apiUrl;
  private final String token;
  private final JsonHttpClient http;

  public TelegramApi(String apiUrl, String token, JsonHttpClient http) {
    this.apiUrl = stripTrailingSlash(apiUrl);
    this.token = token;
    this.http = http;
  }

  public boolean isConfigured() {
    return token != null && !token.isBlank();
  }

  public JsonHttpResponse call(String operation, Map<String, Object> args) {
    TelegramMethod method =
        TelegramMethod.fromOperation(operation)
            .orElseThrow(() -> new UnsupportedMethodException(operation));
    return call(method, args);
  }

  public JsonHttpResponse call(TelegramMethod method, Map<String, Object> args) {
    return http.post(urlFor(method), args == null ? Map.of() : args);
  }

  public String urlFor(TelegramMethod method) {
    return apiUrl + "/bot" + token + "/" + method.endpoint();
  }

  public JsonHttpResponse deleteWebhook() {
    return call(TelegramMethod.DELETE_WEBHOOK, Map.of());
  }

  public JsonHttpResponse setWebhook(String url, String secretToken) {
    Map<String, Object> args = new LinkedHashMap<>();
    args.put("url", url);
    if (secretToken != null && !secretToken.isBlank()) {
      args.put("secret_token", secretToken);
    }
    return call(TelegramMethod.SET_WEBHOOK, args);
  }

  /**
   * @param offset first update id to return, or {@code null} on the very first poll
   * @param timeoutSeconds long-poll timeout; 0 asks for an immediate answer
   */
  public JsonHttpResponse getUpdates(Long offset, int timeoutSeconds) {
    Map<String, Object> args = new LinkedHashMap<>();
    if (offset != null) {
      args.put("offset", offset);
    }
    if (timeoutSeconds > 0) {
      args.put("timeout", timeoutSeconds);
    }
    return call(TelegramMethod.GET_UPDATES, args);
  }

  public JsonHttpResponse sendMessage(long chatId, String text, String parseMode) {
    Map<String, Object> args = new HashMap<>();
    args.put("chat_id", chatId);
    args.put("text", text);
    if (parseMode != null && !parseMode.isBlank()) {
      args.put("parse_mode", parseMode);
    }
    return call(TelegramMethod.SEND_MESSAGE, args);
  }

  public static boolean isOk(JsonNode response) {
    return response != null && response.path("ok").asBoolean(false);
  }

  private static String stripTrailingSlash(String url) {
    if (url == null) return "";
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
