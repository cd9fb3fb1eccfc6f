package com.bottery.telegram.engine;

import static com.bottery.telegram.engine.EngineFixtures.update;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bottery.telegram.client.RecordingJsonHttpClient;
import com.bottery.telegram.client.TelegramApi;
import com.bottery.telegram.translate.MalformedUpdateException;
import com.bottery.telegram.translate.TelegramMessageTranslator;
import com.bottery.telegram.view.PatternViewResolver;
import com.bottery.telegram.view.ViewPattern;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class UpdateDispatcherTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final RecordingJsonHttpClient http = new RecordingJsonHttpClient();
  private final TelegramApi api = new TelegramApi("https://api.telegram.org", "t", http);
  private final ExecutorService pool = Executors.newFixedThreadPool(2);

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  private UpdateDispatcher dispatcher(ViewPattern... patterns) {
    return new UpdateDispatcher(
        new TelegramMessageTranslator(),
        new PatternViewResolver(List.of(patterns)),
        api,
        pool,
        "telegram",
        "Markdown");
  }

  @Test
  void dispatch_noMatchingViewSendsNothing() throws Exception {
    dispatcher(new ViewPattern("ping", m -> "pong"))
        .dispatch(mapper.readTree(update(1, 5, 42, "hi")));

    assertThat(http.calls()).isEmpty();
  }

  @Test
  void dispatch_nonMessageUpdateSendsNothing() throws Exception {
    dispatcher(new ViewPattern("hi", m -> "hello"))
        .dispatch(mapper.readTree("{\"update_id\":3,\"edited_message\":{\"message_id\":5}}"));

    assertThat(http.calls()).isEmpty();
  }

  @Test
  void dispatch_repliesToSender() throws Exception {
    dispatcher(new ViewPattern("hi", m -> "hello " + m.user().id()))
        .dispatch(mapper.readTree(update(1, 5, 42, "hi")));

    assertThat(http.calls())
        .singleElement()
        .satisfies(
            c -> {
              assertThat(c.endpoint()).isEqualTo("sendMessage");
              assertThat(c.body())
                  .containsEntry("chat_id", 42L)
                  .containsEntry("text", "hello 42")
                  .containsEntry("parse_mode", "Markdown");
            });
  }

  @Test
  void dispatch_blankResponseIsNotDelivered() throws Exception {
    dispatcher(new ViewPattern("hi", m -> " ")).dispatch(mapper.readTree(update(1, 5, 42, "hi")));
    dispatcher(new ViewPattern("hi", m -> null)).dispatch(mapper.readTree(update(2, 6, 42, "hi")));

    assertThat(http.calls()).isEmpty();
  }

  @Test
  void dispatch_rejectedDeliveryIsNotRaised() throws Exception {
    http.reply("sendMessage", "{\"ok\":false,\"error_code\":403,\"description\":\"blocked\"}");

    dispatcher(new ViewPattern("hi", m -> "hello"))
        .dispatch(mapper.readTree(update(1, 5, 42, "hi")));

    assertThat(http.endpoints()).containsExactly("sendMessage");
  }

  @Test
  void dispatch_malformedMessagePropagates() throws Exception {
    JsonNode noText = mapper.readTree("{\"message\":{\"message_id\":5,\"from\":{\"id\":1}}}");

    assertThatThrownBy(() -> dispatcher().dispatch(noText))
        .isInstanceOf(MalformedUpdateException.class);
  }

  @Test
  void dispatchAll_failureDoesNotStopSiblings() throws Exception {
    List<JsonNode> batch =
        List.of(
            mapper.readTree(update(1, 5, 41, "boom")),
            mapper.readTree("{\"update_id\":2,\"message\":{\"message_id\":6}}"),
            mapper.readTree(update(3, 7, 43, "hi")));

    dispatcher(
            new ViewPattern(
                "boom",
                m -> {
                  throw new IllegalStateException("view failed");
                }),
            new ViewPattern("hi", m -> "hello"))
        .dispatchAll(batch);

    assertThat(http.callsTo("sendMessage"))
        .singleElement()
        .satisfies(c -> assertThat(c.body()).containsEntry("chat_id", 43L));
  }
}
