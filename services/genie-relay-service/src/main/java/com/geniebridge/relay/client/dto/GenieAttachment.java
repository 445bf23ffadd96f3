package com.geniebridge.relay.client.dto;

/** Message sub-part: free text, a generated query, or both. Absent parts are {@code null}. */
public record GenieAttachment(String text, String query, String queryDescription) {

  public boolean hasText() {
    return text != null && !text.isBlank();
  }

  public boolean hasQueryDescription() {
    return queryDescription != null && !queryDescription.isBlank();
  }
}
