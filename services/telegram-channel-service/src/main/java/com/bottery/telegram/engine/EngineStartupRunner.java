package com.bottery.telegram.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Configures the engine once the context is up; a configuration error aborts startup. */
@Component
@Slf4j
public class EngineStartupRunner implements ApplicationRunner {

  private final TelegramEngine engine;

  public EngineStartupRunner(TelegramEngine engine) {
    this.engine = engine;
  }

  @Override
  public void run(ApplicationArguments args) {
    EngineMode mode = engine.configure();
    log.info("Telegram engine running in {} mode", mode.settingValue());
  }
}
