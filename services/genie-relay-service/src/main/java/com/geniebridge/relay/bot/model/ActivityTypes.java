package com.geniebridge.relay.bot.model;

public final class ActivityTypes {

  public static final String MESSAGE = "message";
  public static final String CONVERSATION_UPDATE = "conversationUpdate";
  public static final String INVOKE = "invoke";

  private ActivityTypes() {}
}
