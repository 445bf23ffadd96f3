package com.geniebridge.relay.orchestration;

public interface ConversationOrchestrator {

  /**
   * Asks {@code question}, starting a new conversation when {@code threadId} is {@code null} and
   * continuing it otherwise. Never throws: failures come back as an error payload.
   */
  ConversationTurn resolve(String question, String threadId);
}
