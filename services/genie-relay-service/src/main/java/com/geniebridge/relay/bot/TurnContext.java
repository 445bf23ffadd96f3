package com.geniebridge.relay.bot;

import com.geniebridge.relay.bot.model.Activity;

/** One inbound activity plus the means to reply to it. */
public class TurnContext {

  private final Activity activity;
  private final ActivitySender sender;

  public TurnContext(Activity activity, ActivitySender sender) {
    this.activity = activity;
    this.sender = sender;
  }

  public Activity activity() {
    return activity;
  }

  public void sendActivity(Activity reply) {
    sender.send(reply);
  }

  public void sendText(String text) {
    sender.send(activity.replyWithText(text));
  }
}
