package com.geniebridge.relay.handler;

import com.fasterxml.jackson.core.JacksonException;
import com.geniebridge.relay.bot.TurnContext;
import com.geniebridge.relay.bot.model.Activity;
import com.geniebridge.relay.bot.model.ActivityTypes;
import com.geniebridge.relay.bot.model.ChannelAccount;
import com.geniebridge.relay.bot.model.InvokeResponse;
import com.geniebridge.relay.config.RelayProperties;
import com.geniebridge.relay.domain.AnswerPayload;
import com.geniebridge.relay.orchestration.ConversationOrchestrator;
import com.geniebridge.relay.orchestration.ConversationTurn;
import com.geniebridge.relay.render.PlainTextRenderer;
import com.geniebridge.relay.render.RenderedReply;
import com.geniebridge.relay.render.ReplyTemplates;
import com.geniebridge.relay.render.SlackBlockRenderer;
import com.geniebridge.relay.session.SessionRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.stereotype.Service;

/**
 * Handles one inbound activity.
 *
 * <p>Message turn: look up the user's conversation, ask Genie, store the returned conversation id
 * (also after a failed turn), render for the channel and reply. Any failure ends in one fixed
 * apology message; nothing propagates to the transport.
 */
@Service
@Slf4j
public class MessageHandler {

  private final SessionRegistry sessions;
  private final ConversationOrchestrator orchestrator;
  private final PlainTextRenderer plainRenderer;
  private final SlackBlockRenderer blockRenderer;
  private final ReplyTemplates templates;
  private final String blocksChannel;

  public MessageHandler(
      SessionRegistry sessions,
      ConversationOrchestrator orchestrator,
      PlainTextRenderer plainRenderer,
      SlackBlockRenderer blockRenderer,
      ReplyTemplates templates,
      RelayProperties properties) {
    this.sessions = sessions;
    this.orchestrator = orchestrator;
    this.plainRenderer = plainRenderer;
    this.blockRenderer = blockRenderer;
    this.templates = templates;
    this.blocksChannel = properties.blocksChannel();
  }

  public Optional<InvokeResponse> onTurn(TurnContext turn) {
    String type = turn.activity().type();
    if (ActivityTypes.MESSAGE.equals(type)) {
      onMessage(turn);
    } else if (ActivityTypes.CONVERSATION_UPDATE.equals(type)) {
      onMembersAdded(turn);
    } else if (ActivityTypes.INVOKE.equals(type)) {
      return Optional.of(InvokeResponse.notImplemented());
    } else {
      log.debug("Ignoring activity type {}", type);
    }
    return Optional.empty();
  }

  void onMessage(TurnContext turn) {
    Activity activity = turn.activity();
    String question = activity.text() == null ? "" : activity.text().trim();
    if (question.isBlank()) {
      log.debug("Ignoring blank message in conversation {}", activity.conversationId());
      return;
    }
    String userId = activity.fromId();

    try {
      String threadId = userId == null ? null : sessions.get(userId).orElse(null);
      ConversationTurn result = orchestrator.resolve(question, threadId);
      if (userId != null && result.threadId() != null) {
        sessions.put(userId, result.threadId());
      }
      if (result.payload() instanceof AnswerPayload.Error) {
        log.warn("Genie turn for user {} ended with an error payload", userId);
      }

      RenderedReply reply = render(result.payload(), activity.channelId());
      turn.sendActivity(toActivity(activity, reply));
    } catch (RuntimeException e) {
      if (isDecodeFailure(e)) {
        log.error("Failed to decode payload for user {}", userId, e);
        sendQuietly(turn, templates.resolve(ReplyTemplates.DECODE_FAILURE, activity.locale()));
      } else {
        log.error("Error processing message for user {}", userId, e);
        sendQuietly(
            turn, templates.resolve(ReplyTemplates.PROCESSING_FAILURE, activity.locale()));
      }
    }
  }

  void onMembersAdded(TurnContext turn) {
    Activity activity = turn.activity();
    List<ChannelAccount> added = activity.membersAdded();
    if (added == null) {
      return;
    }
    for (ChannelAccount member : added) {
      if (member == null || member.id() == null || member.id().equals(activity.recipientId())) {
        continue;
      }
      sendQuietly(turn, templates.resolve(ReplyTemplates.WELCOME, activity.locale()));
    }
  }

  /** Block layout for the configured rich channel, plain text everywhere else. */
  public RenderedReply render(AnswerPayload payload, String channelId) {
    if (blocksChannel.equalsIgnoreCase(channelId)) {
      return new RenderedReply.Blocks(blockRenderer.render(payload));
    }
    return new RenderedReply.PlainText(plainRenderer.render(payload));
  }

  private static Activity toActivity(Activity inbound, RenderedReply reply) {
    if (reply instanceof RenderedReply.Blocks blocks) {
      return inbound.replyWithChannelData(Map.of("blocks", blocks.blocks()));
    }
    return inbound.replyWithText(((RenderedReply.PlainText) reply).text());
  }

  private static boolean isDecodeFailure(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof HttpMessageConversionException || t instanceof JacksonException) {
        return true;
      }
    }
    return false;
  }

  private static void sendQuietly(TurnContext turn, String text) {
    try {
      turn.sendText(text);
    } catch (RuntimeException e) {
      log.warn(
          "Failed to send reply to conversation {}: {}",
          turn.activity().conversationId(),
          e.getMessage());
    }
  }
}
