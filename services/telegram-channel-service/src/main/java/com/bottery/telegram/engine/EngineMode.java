package com.bottery.telegram.engine;

import java.util.Locale;

/** How the engine receives updates. Chosen once, at configuration time. */
public enum EngineMode {
  POLLING {
    @Override
    void configure(TelegramEngine engine) {
      engine.configurePolling();
    }
  },
  WEBHOOK {
    @Override
    void configure(TelegramEngine engine) {
      engine.configureWebhook();
    }
  };

  abstract void configure(TelegramEngine engine);

  public String settingValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Parses {@code bottery.telegram.mode}; blank falls back to polling. */
  public static EngineMode fromSetting(String value) {
    if (value == null || value.isBlank()) {
      return POLLING;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (EngineMode mode : values()) {
      if (mode.settingValue().equals(normalized)) {
        return mode;
      }
    }
    throw new ImproperlyConfiguredException(
        "There's no method to configure " + value.trim() + " mode");
  }
}
