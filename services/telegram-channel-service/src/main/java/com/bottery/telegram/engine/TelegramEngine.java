package com.bottery.telegram.engine;

import com.bottery.telegram.client.JsonHttpResponse;
import com.bottery.telegram.client.TelegramApi;
import com.bottery.telegram.config.TelegramProperties;
import jakarta.annotation.PreDestroy;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Telegram engine: selects polling or webhook ingestion once, at startup.
 *
 * <p>Polling mode removes any webhook and starts a {@link PollingLoop}. Webhook mode registers the
 * configured hostname with Telegram; requests then arrive through {@code
 * TelegramWebhookController}, which only exists in that mode.
 */
@Component
@Slf4j
public class TelegramEngine {

  private final TelegramApi api;
  private final UpdateDispatcher dispatcher;
  private final TaskExecutor pollingExecutor;
  private final TelegramProperties properties;

  private EngineMode mode;
  private PollingLoop pollingLoop;

  public TelegramEngine(
      TelegramApi api,
      UpdateDispatcher dispatcher,
      @Qualifier("pollingTaskExecutor") TaskExecutor pollingExecutor,
      TelegramProperties properties) {
    this.api = api;
    this.dispatcher = dispatcher;
    this.pollingExecutor = pollingExecutor;
    this.properties = properties;
  }

  /**
   * @throws ImproperlyConfiguredException on a missing token, an unknown mode or a mode-specific
   *     setting that is absent
   * @throws IllegalStateException if the engine was already configured
   */
  public synchronized EngineMode configure() {
    if (mode != null) {
      throw new IllegalStateException(
          "Engine " + properties.engineName() + " already configured in " + mode + " mode");
    }
    if (!api.isConfigured()) {
      throw new ImproperlyConfiguredException("Missing TELEGRAM_TOKEN setting");
    }
    EngineMode selected = EngineMode.fromSetting(properties.mode());
    selected.configure(this);
    mode = selected;
    return selected;
  }

  void configurePolling() {
    JsonHttpResponse response = api.deleteWebhook();
    if (TelegramApi.isOk(response.json())) {
      log.debug("[{}] Polling mode set", properties.engineName());
    } else {
      log.warn(
          "[{}] deleteWebhook not acknowledged: {}", properties.engineName(), response.body());
    }

    pollingLoop =
        new PollingLoop(
            api, dispatcher, properties.polling().timeoutSeconds(), properties.engineName());
    pollingExecutor.execute(pollingLoop);
  }

  void configureWebhook() {
    String hostname = properties.hostname();
    if (hostname == null || hostname.isBlank()) {
      throw new ImproperlyConfiguredException("Missing HOSTNAME setting");
    }

    JsonHttpResponse response =
        api.setWebhook(hostname.trim(), properties.webhook().secretToken());
    if (TelegramApi.isOk(response.json())) {
      log.debug("[{}] Webhook mode set", properties.engineName());
    } else {
      log.warn("[{}] setWebhook not acknowledged: {}", properties.engineName(), response.body());
    }
  }

  public synchronized Optional<EngineMode> mode() {
    return Optional.ofNullable(mode);
  }

  Optional<PollingLoop> pollingLoop() {
    return Optional.ofNullable(pollingLoop);
  }

  @PreDestroy
  public synchronized void stop() {
    if (pollingLoop != null) {
      pollingLoop.stop();
    }
  }
}
