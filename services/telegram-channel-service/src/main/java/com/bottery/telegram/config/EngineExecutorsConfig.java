package com.bottery.telegram.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors of the engine: one thread owning the polling loop, and a pool that runs the handlers
 * of one polled batch side by side.
 */
@Configuration
public class EngineExecutorsConfig {

  @Bean
  public TaskExecutor pollingTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("telegram-polling-");
    executor.setDaemon(true);
    executor.initialize();
    return executor;
  }

  @Bean
  public TaskExecutor updateHandlerExecutor(TelegramProperties properties) {
    int threads = properties.polling().handlerThreads();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("telegram-update-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
