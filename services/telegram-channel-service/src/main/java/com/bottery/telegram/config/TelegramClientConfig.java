package com.bottery.telegram.config;

import com.bottery.telegram.client.JsonHttpClient;
import com.bottery.telegram.client.RestClientJsonHttpClient;
import com.bottery.telegram.client.TelegramApi;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class TelegramClientConfig {

  @Bean
  public RestClient telegramRestClient(RestClient.Builder builder, TelegramProperties properties) {
    HttpClient httpClient =
        HttpClient.newBuilder().connectTimeout(properties.http().connectTimeout()).build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    // must outlive the long-poll timeout of getUpdates
    requestFactory.setReadTimeout(properties.http().readTimeout());
    return builder.requestFactory(requestFactory).build();
  }

  @Bean
  public JsonHttpClient jsonHttpClient(RestClient telegramRestClient, ObjectMapper objectMapper) {
    return new RestClientJsonHttpClient(telegramRestClient, objectMapper);
  }

  @Bean
  public TelegramApi telegramApi(JsonHttpClient jsonHttpClient, TelegramProperties properties) {
    String token = properties.token() == null ? "" : properties.token().trim();
    return new TelegramApi(properties.apiUrl(), token, jsonHttpClient);
  }
}
