package com.geniebridge.relay.session;

import java.util.Optional;

/**
 * Chat user id to Genie conversation id.
 *
 * <p>Only single-key reads and writes are atomic. Two concurrent turns of the same user may race
 * on {@link #put}, and the later write wins even if it carries the older conversation id.
 */
public interface SessionRegistry {

  Optional<String> get(String userId);

  void put(String userId, String threadId);
}
