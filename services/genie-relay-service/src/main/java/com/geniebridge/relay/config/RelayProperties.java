package com.geniebridge.relay.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
    String blocksChannel, Duration requestTimeout, Session session, Executor executor) {

  public RelayProperties {
    blocksChannel = blocksChannel == null || blocksChannel.isBlank() ? "slack" : blocksChannel;
    requestTimeout = requestTimeout == null ? Duration.ZERO : requestTimeout;
    session = session == null ? new Session(null, null, null) : session;
    executor = executor == null ? new Executor(null, null, null) : executor;
  }

  /** {@code store}: "memory" (unbounded map) or "expiring" (bounded Caffeine cache). */
  public record Session(String store, Duration ttl, Long maxSize) {
    public Session {
      store = store == null || store.isBlank() ? "memory" : store.trim();
      ttl = ttl == null ? Duration.ofHours(12) : ttl;
      maxSize = maxSize == null ? 10_000L : maxSize;
    }
  }

  public record Executor(Integer coreSize, Integer maxSize, Integer queueCapacity) {
    public Executor {
      coreSize = coreSize == null ? 8 : coreSize;
      maxSize = maxSize == null ? 32 : maxSize;
      queueCapacity = queueCapacity == null ? 200 : queueCapacity;
    }
  }
}
