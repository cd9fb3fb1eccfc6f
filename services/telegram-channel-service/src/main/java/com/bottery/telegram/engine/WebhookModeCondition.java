package com.bottery.telegram.engine;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when {@code bottery.telegram.mode} selects {@link EngineMode#WEBHOOK}, read exactly as
 * {@link EngineMode#fromSetting} reads it for the engine.
 */
public class WebhookModeCondition implements Condition {

  static final String MODE_PROPERTY = "bottery.telegram.mode";

  @Override
  public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
    String value = context.getEnvironment().getProperty(MODE_PROPERTY);
    try {
      return EngineMode.fromSetting(value) == EngineMode.WEBHOOK;
    } catch (ImproperlyConfiguredException e) {
      // unknown mode: TelegramEngine.configure() fails startup with this error
      return false;
    }
  }
}
