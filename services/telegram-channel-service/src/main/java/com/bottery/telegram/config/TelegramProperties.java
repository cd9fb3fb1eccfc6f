package com.bottery.telegram.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the Telegram engine, bound from {@code bottery.telegram.*}.
 *
 * <p>The token and mode are checked by the engine itself at configuration time so that a missing
 * value fails with the same error as an unknown mode.
 */
@Validated
@ConfigurationProperties(prefix = "bottery.telegram")
public record TelegramProperties(
    String token,
    @DefaultValue("polling") String mode,
    String hostname,
    @DefaultValue("https://api.telegram.org") @NotBlank String apiUrl,
    @DefaultValue("telegram") @NotBlank String engineName,
    @DefaultValue("Markdown") String parseMode,
    @DefaultValue @Valid @NotNull Polling polling,
    @DefaultValue @Valid @NotNull Webhook webhook,
    @DefaultValue @Valid @NotNull Http http) {

  public record Polling(
      @DefaultValue("30") @Min(0) int timeoutSeconds,
      @DefaultValue("4") @Min(1) int handlerThreads) {}

  public record Webhook(String secretToken) {

    public boolean hasSecretToken() {
      return secretToken != null && !secretToken.isBlank();
    }
  }

  public record Http(
      @DefaultValue("5s") Duration connectTimeout, @DefaultValue("60s") Duration readTimeout) {}
}
