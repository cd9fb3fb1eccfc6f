package com.bottery.telegram;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TelegramChannelServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(TelegramChannelServiceApplication.class, args);
  }
}
