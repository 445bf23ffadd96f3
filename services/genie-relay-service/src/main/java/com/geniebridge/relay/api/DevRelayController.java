package com.geniebridge.relay.api;

import com.geniebridge.relay.bot.TurnContext;
import com.geniebridge.relay.bot.model.Activity;
import com.geniebridge.relay.bot.model.ActivityTypes;
import com.geniebridge.relay.bot.model.ChannelAccount;
import com.geniebridge.relay.bot.model.ConversationAccount;
import com.geniebridge.relay.handler.MessageHandler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ask Genie from curl without a chat channel.
 *
 * <p>Builds a message activity for the given user and channel, runs it through {@link
 * MessageHandler} and returns the reply activities instead of posting them to the Bot Connector.
 * Enabled only when relay.dev.enabled=true.
 */
@RestController
@RequestMapping("/dev/relay")
@ConditionalOnProperty(name = "relay.dev.enabled", havingValue = "true")
public class DevRelayController {

  private final MessageHandler handler;

  public DevRelayController(MessageHandler handler) {
    this.handler = handler;
  }

  public record DevMessageRequest(@NotBlank String userId, String channel, @NotBlank String text) {}

  @PostMapping("/message")
  public List<Activity> message(@Valid @RequestBody DevMessageRequest req) {
    String channel = req.channel() == null || req.channel().isBlank() ? "emulator" : req.channel();
    Activity activity =
        new Activity(
            ActivityTypes.MESSAGE,
            UUID.randomUUID().toString(),
            channel,
            null,
            new ChannelAccount(req.userId(), null),
            new ChannelAccount("genie-relay", "Genie Relay"),
            new ConversationAccount("dev|" + req.userId(), null, false),
            null,
            req.text(),
            null,
            null,
            null,
            null);
    List<Activity> replies = new ArrayList<>();
    handler.onTurn(new TurnContext(activity, replies::add));
    return replies;
  }
}
