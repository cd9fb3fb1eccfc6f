package com.bottery.telegram.api;

import com.bottery.telegram.engine.EngineMode;
import com.bottery.telegram.engine.TelegramEngine;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PingController {

  private final TelegramEngine engine;

  public PingController(TelegramEngine engine) {
    this.engine = engine;
  }

  @GetMapping("/ping")
  public Map<String, String> ping() {
    return Map.of(
        "service", "telegram-channel-service",
        "status", "ok",
        "mode", engine.mode().map(EngineMode::settingValue).orElse("unconfigured"));
  }
}
