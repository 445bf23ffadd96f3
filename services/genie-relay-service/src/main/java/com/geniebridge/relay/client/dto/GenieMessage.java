package com.geniebridge.relay.client.dto;

import java.util.List;
import java.util.Locale;

public record GenieMessage(
    String id,
    String conversationId,
    String content,
    String status,
    List<GenieAttachment> attachments,
    boolean hasQueryResult,
    String error) {

  public static final String COMPLETED = "COMPLETED";
  public static final String FAILED = "FAILED";
  public static final String CANCELLED = "CANCELLED";
  public static final String QUERY_RESULT_EXPIRED = "QUERY_RESULT_EXPIRED";

  public GenieMessage {
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  public boolean isCompleted() {
    return COMPLETED.equals(normalizedStatus());
  }

  public boolean isFailed() {
    String s = normalizedStatus();
    return FAILED.equals(s) || CANCELLED.equals(s) || QUERY_RESULT_EXPIRED.equals(s);
  }

  private String normalizedStatus() {
    return status == null ? "" : status.trim().toUpperCase(Locale.ROOT);
  }
}
