package com.bottery.telegram.view;

import static org.assertj.core.api.Assertions.assertThat;

import com.bottery.telegram.model.Message;
import com.bottery.telegram.model.TelegramUser;
import java.util.List;
import org.junit.jupiter.api.Test;

class PatternViewResolverTest {

  private static Message text(String text) {
    return new Message(1, "telegram", text, new TelegramUser(42, "A", null, null, null), 0, null);
  }

  @Test
  void resolve_exactTextMatch() {
    PatternViewResolver resolver =
        new PatternViewResolver(List.of(new ViewPattern("ping", m -> "pong")));

    assertThat(resolver.resolve(text("ping"))).hasValueSatisfying(
        h -> assertThat(h.handle(text("ping"))).isEqualTo("pong"));
    assertThat(resolver.resolve(text("Ping"))).isEmpty();
    assertThat(resolver.resolve(text("ping me"))).isEmpty();
  }

  @Test
  void resolve_firstRegisteredWins() {
    PatternViewResolver resolver =
        new PatternViewResolver(
            List.of(new ViewPattern("hi", m -> "first"), new ViewPattern("hi", m -> "second")));

    assertThat(resolver.resolve(text("hi")).orElseThrow().handle(text("hi"))).isEqualTo("first");
  }

  @Test
  void resolve_withoutPatternsFindsNothing() {
    assertThat(new PatternViewResolver(List.of()).resolve(text("anything"))).isEmpty();
  }
}
