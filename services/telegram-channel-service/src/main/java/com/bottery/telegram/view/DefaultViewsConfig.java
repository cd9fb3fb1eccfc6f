package com.bottery.telegram.view;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DefaultViewsConfig {

  @Bean
  public ViewPattern pingView() {
    return new ViewPattern("ping", message -> "pong");
  }
}
