package com.bottery.telegram.view;

import com.bottery.telegram.model.Message;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** First registered {@link ViewPattern} matching the message text wins. */
@Component
@Slf4j
public class PatternViewResolver implements ViewResolver {

  private final List<ViewPattern> patterns;

  @Autowired
  public PatternViewResolver(ObjectProvider<ViewPattern> patterns) {
    this(patterns.orderedStream().toList());
  }

  public PatternViewResolver(List<ViewPattern> patterns) {
    this.patterns = List.copyOf(patterns);
    log.info("Registered {} view pattern(s)", this.patterns.size());
  }

  @Override
  public Optional<MessageHandler> resolve(Message message) {
    for (ViewPattern p : patterns) {
      if (p.matches(message)) {
        return Optional.of(p.view());
      }
    }
    return Optional.empty();
  }
}
