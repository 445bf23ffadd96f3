package com.geniebridge.relay.session;

import com.geniebridge.relay.config.RelayProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Bounded session store. Entries expire after {@code relay.session.ttl} without a turn; past
 * {@code relay.session.max-size} the least recently used users are evicted. An evicted user simply
 * starts a new Genie conversation.
 */
@Service
@ConditionalOnProperty(name = "relay.session.store", havingValue = "expiring")
public class ExpiringSessionRegistry implements SessionRegistry {

  private final Cache<String, String> cache;

  @Autowired
  public ExpiringSessionRegistry(RelayProperties properties) {
    this(properties.session(), Ticker.systemTicker());
  }

  ExpiringSessionRegistry(RelayProperties.Session session, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .expireAfterAccess(session.ttl())
            .maximumSize(session.maxSize())
            .ticker(ticker)
            .build();
  }

  @Override
  public Optional<String> get(String userId) {
    if (userId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(cache.getIfPresent(userId));
  }

  @Override
  public void put(String userId, String threadId) {
    if (userId == null || threadId == null) {
      return;
    }
    cache.put(userId, threadId);
  }
}
