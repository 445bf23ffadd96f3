package com.geniebridge.relay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.geniebridge.relay.client.dto.GenieAttachment;
import com.geniebridge.relay.client.dto.GenieMessage;
import com.geniebridge.relay.config.GenieProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Genie conversation API.
 *
 * <p>Start and follow-up calls return as soon as the message is accepted; the {@code *AndWait}
 * variants poll the message until it reaches a terminal status. Poll delay grows linearly from
 * {@code genie.poll-interval} up to {@code genie.max-poll-interval}.
 */
@Component
@Slf4j
public class GenieClient {

  private static final String SPACE = "/api/2.0/genie/spaces/{spaceId}";
  private static final String MESSAGE =
      SPACE + "/conversations/{conversationId}/messages/{messageId}";

  private final WorkspaceApi api;
  private final GenieProperties properties;

  public GenieClient(WorkspaceApi api, GenieProperties properties) {
    this.api = api;
    this.properties = properties;
  }

  public GenieMessage startConversationAndWait(String spaceId, String question) {
    JsonNode root = api.post(SPACE + "/start-conversation", Map.of("content", question), spaceId);
    String conversationId = text(root, "conversation_id");
    String messageId = text(root, "message_id");
    if (conversationId == null || messageId == null) {
      JsonNode message = root.path("message");
      conversationId = conversationId == null ? text(message, "conversation_id") : conversationId;
      messageId = messageId == null ? messageId(message) : messageId;
    }
    if (conversationId == null || messageId == null) {
      throw new GenieClientException("start-conversation response has no conversation/message id");
    }
    log.info(
        "Genie conversation started: conversationId={} messageId={}", conversationId, messageId);
    return waitForCompletion(spaceId, conversationId, messageId);
  }

  public GenieMessage createMessageAndWait(String spaceId, String conversationId, String question) {
    JsonNode root =
        api.post(
            SPACE + "/conversations/{conversationId}/messages",
            Map.of("content", question),
            spaceId,
            conversationId);
    String messageId = messageId(root);
    if (messageId == null) {
      throw new GenieClientException("create-message response has no message id");
    }
    String resolvedConversation = text(root, "conversation_id");
    return waitForCompletion(
        spaceId, resolvedConversation == null ? conversationId : resolvedConversation, messageId);
  }

  public GenieMessage getMessage(String spaceId, String conversationId, String messageId) {
    return parseMessage(api.get(MESSAGE, spaceId, conversationId, messageId));
  }

  /** Statement id behind the message's query result, if the message ran a query. */
  public Optional<String> getMessageQueryResultStatementId(
      String spaceId, String conversationId, String messageId) {
    JsonNode root = api.get(MESSAGE + "/query-result", spaceId, conversationId, messageId);
    return Optional.ofNullable(text(root.path("statement_response"), "statement_id"));
  }

  GenieMessage waitForCompletion(String spaceId, String conversationId, String messageId) {
    Instant deadline = Instant.now().plus(properties.waitTimeout());
    int attempt = 1;
    while (true) {
      GenieMessage message = getMessage(spaceId, conversationId, messageId);
      if (message.isCompleted()) {
        return message;
      }
      if (message.isFailed()) {
        throw new GenieClientException(
            "Genie message "
                + messageId
                + " ended with status "
                + message.status()
                + (message.error() == null ? "" : ": " + message.error()));
      }
      if (Instant.now().isAfter(deadline)) {
        throw new GenieClientException(
            "Timed out after " + properties.waitTimeout() + " waiting for message " + messageId);
      }
      log.debug("Genie message {} status={} attempt={}", messageId, message.status(), attempt);
      sleep(pollDelay(attempt));
      attempt++;
    }
  }

  Duration pollDelay(int attempt) {
    Duration delay = properties.pollInterval().multipliedBy(attempt);
    return delay.compareTo(properties.maxPollInterval()) > 0 ? properties.maxPollInterval() : delay;
  }

  private static void sleep(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenieClientException("Interrupted while waiting for Genie", e);
    }
  }

  static GenieMessage parseMessage(JsonNode node) {
    List<GenieAttachment> attachments = new ArrayList<>();
    for (JsonNode a : node.path("attachments")) {
      attachments.add(
          new GenieAttachment(
              text(a.path("text"), "content"),
              text(a.path("query"), "query"),
              text(a.path("query"), "description")));
    }
    JsonNode queryResult = node.path("query_result");
    boolean hasQueryResult = !queryResult.isMissingNode() && !queryResult.isNull();
    JsonNode error = node.path("error");
    String errorText = error.isObject() ? text(error, "error") : text(node, "error");
    return new GenieMessage(
        messageId(node),
        text(node, "conversation_id"),
        text(node, "content"),
        text(node, "status"),
        attachments,
        hasQueryResult,
        errorText);
  }

  private static String messageId(JsonNode node) {
    String id = text(node, "id");
    return id == null ? text(node, "message_id") : id;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
      return null;
    }
    return value.asText();
  }
}
