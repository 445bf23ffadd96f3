package com.geniebridge.relay.bot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Bot Framework activity envelope, limited to the fields the relay reads or writes. Unknown fields
 * are ignored on input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Activity(
    @NotBlank String type,
    String id,
    String channelId,
    String serviceUrl,
    ChannelAccount from,
    ChannelAccount recipient,
    ConversationAccount conversation,
    String replyToId,
    String text,
    String textFormat,
    String locale,
    List<ChannelAccount> membersAdded,
    Object channelData) {

  public Activity {
    membersAdded = membersAdded == null ? null : List.copyOf(membersAdded);
  }

  /** Text reply addressed back to the sender of this activity. */
  public Activity replyWithText(String replyText) {
    return new Activity(
        ActivityTypes.MESSAGE,
        null,
        channelId,
        serviceUrl,
        recipient,
        from,
        conversation,
        id,
        replyText,
        "markdown",
        locale,
        null,
        null);
  }

  /** Reply whose content travels in channel-native {@code channelData}. */
  public Activity replyWithChannelData(Object replyChannelData) {
    return new Activity(
        ActivityTypes.MESSAGE,
        null,
        channelId,
        serviceUrl,
        recipient,
        from,
        conversation,
        id,
        null,
        null,
        locale,
        null,
        replyChannelData);
  }

  public String fromId() {
    return from == null ? null : from.id();
  }

  public String recipientId() {
    return recipient == null ? null : recipient.id();
  }

  public String conversationId() {
    return conversation == null ? null : conversation.id();
  }
}
