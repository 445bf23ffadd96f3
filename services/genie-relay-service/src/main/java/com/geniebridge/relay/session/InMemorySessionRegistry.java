package com.geniebridge.relay.session;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Process-wide map with no eviction, expiry or persistence. Grows with every distinct user; switch
 * to {@code relay.session.store=expiring} for long-running deployments.
 */
@Service
@ConditionalOnProperty(name = "relay.session.store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionRegistry implements SessionRegistry {

  private final ConcurrentMap<String, String> map = new ConcurrentHashMap<>();

  @Override
  public Optional<String> get(String userId) {
    if (userId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(map.get(userId));
  }

  @Override
  public void put(String userId, String threadId) {
    if (userId == null || threadId == null) {
      return;
    }
    map.put(userId, threadId);
  }

  public int size() {
    return map.size();
  }
}
