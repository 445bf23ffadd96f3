package com.geniebridge.relay.bot;

/** 401 with a stable JSON payload via ApiExceptionHandler. */
public class BotAuthenticationException extends RuntimeException {
  public BotAuthenticationException(String message) {
    super(message);
  }
}
