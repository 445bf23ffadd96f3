package com.geniebridge.relay.orchestration;

import com.geniebridge.relay.client.GenieClient;
import com.geniebridge.relay.client.StatementExecutionClient;
import com.geniebridge.relay.client.dto.GenieAttachment;
import com.geniebridge.relay.client.dto.GenieMessage;
import com.geniebridge.relay.client.dto.StatementResult;
import com.geniebridge.relay.config.GenieProperties;
import com.geniebridge.relay.domain.AnswerPayload;
import com.geniebridge.relay.render.ReplyTemplates;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one question through Genie: ask (or follow up) and wait, then pick the richest answer the
 * message offers. Statement result first, then the first text attachment, then the raw content.
 *
 * <p>Start and follow-up calls are not retried: Genie has no idempotency key, so a retry could
 * post the same turn twice.
 */
@Service
@Slf4j
public class GenieConversationOrchestrator implements ConversationOrchestrator {

  private final GenieClient genie;
  private final StatementExecutionClient statements;
  private final ReplyTemplates templates;
  private final String spaceId;

  public GenieConversationOrchestrator(
      GenieClient genie,
      StatementExecutionClient statements,
      ReplyTemplates templates,
      GenieProperties properties) {
    this.genie = genie;
    this.statements = statements;
    this.templates = templates;
    this.spaceId = properties.spaceId();
  }

  @Override
  public ConversationTurn resolve(String question, String threadId) {
    String conversationId = threadId;
    try {
      GenieMessage initial =
          threadId == null
              ? genie.startConversationAndWait(spaceId, question)
              : genie.createMessageAndWait(spaceId, threadId, question);
      if (initial.conversationId() != null) {
        conversationId = initial.conversationId();
      }

      Optional<String> statementId = Optional.empty();
      if (initial.hasQueryResult()) {
        statementId =
            genie.getMessageQueryResultStatementId(spaceId, conversationId, initial.id());
      }
      GenieMessage message = genie.getMessage(spaceId, conversationId, initial.id());

      if (statementId.isPresent()) {
        StatementResult result = statements.getStatement(statementId.get());
        return new ConversationTurn(
            new AnswerPayload.Tabular(result.columns(), result.rows(), queryDescription(message)),
            conversationId);
      }
      for (GenieAttachment attachment : message.attachments()) {
        if (attachment.hasText()) {
          return new ConversationTurn(
              new AnswerPayload.Message(attachment.text()), conversationId);
        }
      }
      return new ConversationTurn(new AnswerPayload.Message(message.content()), conversationId);
    } catch (RuntimeException e) {
      log.error(
          "Genie turn failed (conversationId={}, followUp={})",
          conversationId,
          threadId != null,
          e);
      return new ConversationTurn(
          new AnswerPayload.Error(templates.resolve(ReplyTemplates.BACKEND_ERROR)), conversationId);
    }
  }

  private static String queryDescription(GenieMessage message) {
    for (GenieAttachment attachment : message.attachments()) {
      if (attachment.hasQueryDescription()) {
        return attachment.queryDescription();
      }
    }
    return null;
  }
}
