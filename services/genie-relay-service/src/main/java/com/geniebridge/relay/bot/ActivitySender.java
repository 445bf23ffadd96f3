package com.geniebridge.relay.bot;

import com.geniebridge.relay.bot.model.Activity;

@FunctionalInterface
public interface ActivitySender {
  void send(Activity reply);
}
