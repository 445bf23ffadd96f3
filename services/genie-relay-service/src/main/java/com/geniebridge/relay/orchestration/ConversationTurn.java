package com.geniebridge.relay.orchestration;

import com.geniebridge.relay.domain.AnswerPayload;

/**
 * Outcome of one turn. {@code threadId} is the conversation to continue next time; it is set even
 * when {@code payload} is an error, and is {@code null} only if no conversation was ever started.
 */
public record ConversationTurn(AnswerPayload payload, String threadId) {}
