package com.geniebridge.relay.render.block;

public record MarkdownText(String type, String text) {

  public static MarkdownText of(String text) {
    return new MarkdownText("mrkdwn", text);
  }
}
