package com.geniebridge.relay.bot.model;

/** Synchronous answer to an {@code invoke} activity, returned as the HTTP response. */
public record InvokeResponse(int status, Object body) {

  public static InvokeResponse notImplemented() {
    return new InvokeResponse(501, null);
  }
}
