package com.geniebridge.relay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for inbound turns. Genie calls block for seconds to minutes, so each turn runs here
 * instead of on a servlet thread.
 */
@Configuration
public class RelayExecutorConfig {

  @Bean(name = "relayExecutor")
  public ThreadPoolTaskExecutor relayExecutor(RelayProperties properties) {
    RelayProperties.Executor cfg = properties.executor();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(cfg.coreSize());
    executor.setMaxPoolSize(cfg.maxSize());
    executor.setQueueCapacity(cfg.queueCapacity());
    executor.setThreadNamePrefix("relay-turn-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
