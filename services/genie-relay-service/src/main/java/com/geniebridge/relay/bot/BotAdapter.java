package com.geniebridge.relay.bot;

import com.geniebridge.relay.bot.model.Activity;
import com.geniebridge.relay.bot.model.InvokeResponse;
import com.geniebridge.relay.client.BotConnectorClient;
import com.geniebridge.relay.config.BotProperties;
import com.geniebridge.relay.handler.MessageHandler;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Glue between the HTTP endpoint and {@link MessageHandler}: checks the caller, wires replies to
 * the Bot Connector and returns the synchronous invoke response when there is one.
 *
 * <p>Only the presence of a bearer token is checked. Validating its signature against the
 * channel's OpenID metadata is left to a fronting gateway.
 */
@Component
@Slf4j
public class BotAdapter {

  private final MessageHandler handler;
  private final BotConnectorClient connector;
  private final BotProperties properties;

  public BotAdapter(
      MessageHandler handler, BotConnectorClient connector, BotProperties properties) {
    this.handler = handler;
    this.connector = connector;
    this.properties = properties;
  }

  public void authenticate(String authHeader) {
    if (!properties.isAuthEnabled()) {
      return;
    }
    if (authHeader == null || !authHeader.regionMatches(true, 0, "Bearer ", 0, 7)
        || authHeader.substring(7).isBlank()) {
      throw new BotAuthenticationException("Missing bearer token");
    }
  }

  public Optional<InvokeResponse> processActivity(Activity activity) {
    log.debug(
        "Activity type={} channel={} conversation={}",
        activity.type(),
        activity.channelId(),
        activity.conversationId());
    TurnContext turn =
        new TurnContext(activity, reply -> connector.replyToActivity(activity, reply));
    return handler.onTurn(turn);
  }
}
