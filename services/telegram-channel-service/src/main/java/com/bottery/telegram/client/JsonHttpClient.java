package com.bottery.telegram.client;

import java.util.Map;

/** Minimal transport the Bot API proxy needs: POST a JSON object, get the raw response back. */
public interface JsonHttpClient {

  /**
   * Sends {@code body} serialized as JSON to {@code url}.
   *
   * @throws TelegramApiException when the request cannot be performed at all
   */
  JsonHttpResponse post(String url, Map<String, Object> body);
}
