package com.geniebridge.relay.client;

import com.geniebridge.relay.bot.model.Activity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * Sends reply activities to the channel's Bot Connector at the inbound activity's {@code
 * serviceUrl}. Failures propagate to the caller.
 */
@Service
@Slf4j
public class BotConnectorClient {

  private final RestClient rest;
  private final BotTokenProvider tokens;

  public BotConnectorClient(RestClient.Builder builder, BotTokenProvider tokens) {
    this.rest = builder.build();
    this.tokens = tokens;
  }

  public void replyToActivity(Activity inbound, Activity reply) {
    String serviceUrl = inbound.serviceUrl();
    String conversationId = inbound.conversationId();
    if (serviceUrl == null || serviceUrl.isBlank() || conversationId == null) {
      throw new IllegalArgumentException("Activity has no serviceUrl or conversation id");
    }
    String base = trimTrailingSlash(serviceUrl) + "/v3/conversations/{conversationId}/activities";
    RestClient.RequestBodySpec request =
        inbound.id() == null || inbound.id().isBlank()
            ? rest.post().uri(base, conversationId)
            : rest.post().uri(base + "/{activityId}", conversationId, inbound.id());
    tokens.token().ifPresent(t -> request.header(HttpHeaders.AUTHORIZATION, "Bearer " + t));
    request.contentType(MediaType.APPLICATION_JSON).body(reply).retrieve().toBodilessEntity();
    log.debug("Reply sent to conversation {}", conversationId);
  }

  private static String trimTrailingSlash(String url) {
    String out = url.trim();
    while (out.endsWith("/")) {
      out = out.substring(0, out.length() - 1);
    }
    return out;
  }
}
