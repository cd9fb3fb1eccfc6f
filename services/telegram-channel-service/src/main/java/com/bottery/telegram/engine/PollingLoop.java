package com.bottery.telegram.engine;

import com.bottery.telegram.client.TelegramApi;
import com.bottery.telegram.client.TelegramApiException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Long-poll loop over {@code getUpdates}.
 *
 * <p>The cursor (last seen {@code update_id}) lives on the loop thread only. Each request asks for
 * {@code cursor + 1} so Telegram does not redeliver seen updates. A batch is fully handled before
 * the next request goes out.
 */
@Slf4j
public class PollingLoop implements Runnable {

  private final TelegramApi api;
  private final UpdateDispatcher dispatcher;
  private final int timeoutSeconds;
  private final String engineName;
  private final AtomicBoolean running = new AtomicBoolean(true);

  public PollingLoop(
      TelegramApi api, UpdateDispatcher dispatcher, int timeoutSeconds, String engineName) {
    this.api = api;
    this.dispatcher = dispatcher;
    this.timeoutSeconds = timeoutSeconds;
    this.engineName = engineName;
  }

  @Override
  public void run() {
    Long cursor = null;
    log.info("[{}] Polling started", engineName);
    while (running.get()) {
      try {
        cursor = poll(cursor);
      } catch (RuntimeException e) {
        // no retry: a failed getUpdates ends polling
        if (running.getAndSet(false)) {
          log.error("[{}] Polling stopped after getUpdates failure", engineName, e);
        } else {
          log.debug("[{}] In-flight getUpdates aborted by stop: {}", engineName, e.getMessage());
        }
      }
    }
    log.info("[{}] Polling finished", engineName);
  }

  /**
   * One iteration: fetch, advance the cursor, dispatch the batch.
   *
   * @param lastUpdateId last seen update id, {@code null} before the first update
   * @return the cursor for the next iteration
   */
  Long poll(Long lastUpdateId) {
    Long offset = lastUpdateId == null ? null : lastUpdateId + 1;
    JsonNode response = api.getUpdates(offset, timeoutSeconds).json();
    if (!TelegramApi.isOk(response)) {
      throw new TelegramApiException(
          "getUpdates rejected: " + response.path("description").asText("no description"));
    }

    List<JsonNode> updates = new ArrayList<>();
    response.path("result").forEach(updates::add);

    Long next = lastUpdateId;
    if (!updates.isEmpty()) {
      long last = updates.get(updates.size() - 1).path("update_id").asLong();
      next = next == null ? last : Math.max(next, last);
    }

    dispatcher.dispatchAll(updates);
    return next;
  }

  public void stop() {
    running.set(false);
  }

  public boolean isRunning() {
    return running.get();
  }
}
