package com.bottery.telegram.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link JsonHttpClient} on top of Spring's {@link RestClient}.
 *
 * <p>Error statuses are returned as responses rather than thrown: the Bot API answers 4xx with a
 * JSON body carrying {@code ok=false}, which the caller inspects.
 */
public class RestClientJsonHttpClient implements JsonHttpClient {

  private final RestClient rest;
  private final ObjectMapper objectMapper;

  public RestClientJsonHttpClient(RestClient rest, ObjectMapper objectMapper) {
    this.rest = rest;
    this.objectMapper = objectMapper;
  }

  @Override
  public JsonHttpResponse post(String url, Map<String, Object> body) {
    try {
      return rest.post()
          .uri(url)
          .contentType(MediaType.APPLICATION_JSON)
          .body(body)
          .exchange(
              (request, response) ->
                  new JsonHttpResponse(
                      response.getStatusCode().value(),
                      StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8),
                      objectMapper));
    } catch (RestClientException e) {
      throw new TelegramApiException("HTTP call failed: " + e.getMessage(), e);
    }
  }
}
